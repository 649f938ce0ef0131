import com.fluxo.protocol.MalformedMessageException;
import com.fluxo.protocol.MessageType;
import com.fluxo.protocol.ModuleMessage;
import com.fluxo.protocol.ModuleMessageCodec;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ModuleMessageCodecTest {

    private final ModuleMessageCodec codec = new ModuleMessageCodec();

    @Test
    public void request_encodesOnlyTypeAndPath() {
        String json = codec.encode(ModuleMessage.request("/lib/a.fxm"));
        assertEquals("{\"type\":\"module-request\",\"path\":\"/lib/a.fxm\"}", json);
    }

    @Test
    public void response_decodes() {
        ModuleMessage m = codec.decode("{\"type\":\"module-response\",\"path\":\"/a.fxm\",\"code\":\"module a { }\"}");
        assertEquals(MessageType.MODULE_RESPONSE, m.type());
        assertEquals("/a.fxm", m.path());
        assertEquals("module a { }", m.code());
        assertNull(m.error());
    }

    @Test
    public void emptyCode_isAValidResponse() {
        ModuleMessage m = codec.decode("{\"type\":\"module-response\",\"path\":\"/a.fxm\",\"code\":\"\"}");
        assertEquals("", m.code());
    }

    @Test
    public void missingRequiredFields_areRejected() {
        assertThrows(MalformedMessageException.class,
                () -> codec.decode("{\"type\":\"module-response\",\"path\":\"/a.fxm\"}"));
        assertThrows(MalformedMessageException.class,
                () -> codec.decode("{\"type\":\"module-error\",\"path\":\"/a.fxm\"}"));
        assertThrows(MalformedMessageException.class,
                () -> codec.decode("{\"type\":\"module-request\",\"path\":\"\"}"));
        assertThrows(MalformedMessageException.class,
                () -> codec.decode("{\"type\":\"execute\"}"));
    }

    @Test
    public void unknownTypeOrShape_isRejected() {
        assertThrows(MalformedMessageException.class, () -> codec.decode("{\"type\":\"other\",\"path\":\"/a\"}"));
        assertThrows(MalformedMessageException.class, () -> codec.decode("[1,2]"));
        assertThrows(MalformedMessageException.class, () -> codec.decode("{\"path\":\"/a\"}"));
        assertThrows(MalformedMessageException.class, () -> codec.decode("{\"type\":\"module-request\",\"path\":7}"));
        assertThrows(MalformedMessageException.class, () -> codec.decode("not json"));
    }
}
