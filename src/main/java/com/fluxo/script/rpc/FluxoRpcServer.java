package com.fluxo.script.rpc;

import com.fluxo.debug.Debug;
import com.fluxo.script.ExecuteRequest;
import com.fluxo.script.ExecuteResult;
import com.fluxo.script.FluxoConfig;
import com.fluxo.script.FluxoScript;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.*;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Supplier;

/**
 * Framed-JSON RPC front end for batch runs:
 * Frame = uint32_be length + UTF-8 JSON payload
 *
 * Supports:
 *  - {"id":..,"method":"execute","args":{"files":[{"path":..,"code":..}],"entryPoint":..}}
 *    Response: {"id":..,"ok":true,"result":{"events":[...]}}
 *  - {"id":..,"method":"ping"}
 *
 * Every execute call gets a fresh engine run; nothing survives between calls.
 */
public final class FluxoRpcServer implements Closeable {

    private static final String TAG = "FluxoRpcServer";
    private static final int MAX_FRAME_BYTES = 32 * 1024 * 1024;

    private final ObjectMapper om = new ObjectMapper();
    private final int port;
    private final ExecutorService pool;
    private final Supplier<FluxoScript> engines;
    private volatile boolean running = true;
    private ServerSocket serverSocket;

    public FluxoRpcServer(int port, int threads, Supplier<FluxoScript> engines) {
        this.port = port;
        this.pool = Executors.newFixedThreadPool(Math.max(1, threads));
        this.engines = engines;
    }

    public void start() throws IOException {
        serverSocket = new ServerSocket(port, 50, InetAddress.getLoopbackAddress());
        Debug.get().i(TAG, "RPC listening on 127.0.0.1:" + port);

        while (running) {
            Socket s;
            try {
                s = serverSocket.accept();
            } catch (IOException e) {
                if (!running) break;
                throw e;
            }
            s.setTcpNoDelay(true);
            pool.submit(() -> handleClient(s));
        }
    }

    private void handleClient(Socket s) {
        String peer = s.getRemoteSocketAddress().toString();
        Debug.get().d(TAG, "client connected: " + peer);

        try (Socket socket = s;
             InputStream in = new BufferedInputStream(socket.getInputStream());
             OutputStream out = new BufferedOutputStream(socket.getOutputStream())) {

            while (running) {
                byte[] payload = readFrame(in);
                if (payload == null) break; // EOF

                ObjectNode resp;
                try {
                    resp = process(om.readTree(payload));
                } catch (IOException e) {
                    resp = om.createObjectNode();
                    resp.put("ok", false);
                    resp.put("error", "Invalid JSON: " + e.getMessage());
                }

                writeFrame(out, om.writeValueAsBytes(resp));
                out.flush();
            }

        } catch (IOException e) {
            Debug.get().w(TAG, "client error " + peer + " : " + e.getMessage());
        } finally {
            Debug.get().d(TAG, "client disconnected: " + peer);
        }
    }

    /** Handles one request object and builds its response. */
    public ObjectNode process(JsonNode req) {
        ObjectNode resp = om.createObjectNode();
        JsonNode id = req.get("id");
        if (id != null) resp.set("id", id);

        try {
            String method = req.path("method").asText("");

            // Support both "args" and "params"
            JsonNode args = req.has("args") ? req.get("args") : req.get("params");

            switch (method) {
                case "execute": {
                    if (args == null || !args.isObject() || !args.path("files").isArray()) {
                        resp.put("ok", false);
                        resp.put("error", "execute requires args.files array");
                        return resp;
                    }
                    ExecuteRequest request = om.treeToValue(args, ExecuteRequest.class);
                    ExecuteResult result = engines.get().execute(request);
                    resp.put("ok", result.error() == null);
                    resp.set("result", om.valueToTree(result));
                    break;
                }

                case "ping": {
                    resp.put("ok", true);
                    resp.put("result", "pong");
                    break;
                }

                default: {
                    resp.put("ok", false);
                    resp.put("error", "Unknown method: " + method);
                    break;
                }
            }

        } catch (IOException | RuntimeException e) {
            Debug.get().w(TAG, "request failed: " + e);
            resp.put("ok", false);
            resp.put("error", e.toString());
        }

        return resp;
    }

    // -------------------------------
    // Framing helpers
    // -------------------------------

    static byte[] readFrame(InputStream in) throws IOException {
        byte[] lenBuf = in.readNBytes(4);
        if (lenBuf.length == 0) return null;
        if (lenBuf.length < 4) throw new EOFException("partial length header");

        int len = ByteBuffer.wrap(lenBuf).order(ByteOrder.BIG_ENDIAN).getInt();
        if (len < 0 || len > MAX_FRAME_BYTES) {
            throw new IOException("bad frame length: " + len);
        }
        byte[] payload = in.readNBytes(len);
        if (payload.length < len) throw new EOFException("partial frame payload");
        return payload;
    }

    static void writeFrame(OutputStream out, byte[] payload) throws IOException {
        byte[] lenBuf = ByteBuffer.allocate(4).order(ByteOrder.BIG_ENDIAN).putInt(payload.length).array();
        out.write(lenBuf);
        out.write(payload);
    }

    @Override
    public void close() throws IOException {
        running = false;
        if (serverSocket != null) serverSocket.close();
        pool.shutdownNow();
    }

    public static void main(String[] args) throws Exception {
        int port = (args.length > 0) ? Integer.parseInt(args[0]) : 7777;
        int threads = (args.length > 1) ? Integer.parseInt(args[1]) : 4;
        Debug.useSlf4j();
        FluxoConfig config = FluxoConfig.fromClasspath();
        try (FluxoRpcServer server = new FluxoRpcServer(port, threads, () -> config.applyTo(new FluxoScript()))) {
            server.start();
        }
    }
}
