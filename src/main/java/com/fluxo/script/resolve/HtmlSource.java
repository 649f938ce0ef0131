package com.fluxo.script.resolve;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Pulls Fluxo code out of {@code <script type="text/fluxo">} tags of an HTML page. */
public final class HtmlSource {

    public static final String NO_SCRIPTS_WARNING = "No <script type=\"text/fluxo\"> tags found in HTML file";

    private static final Pattern SCRIPT_TAG = Pattern.compile(
            "<script\\b[^>]*\\btype\\s*=\\s*[\"']text/fluxo[\"'][^>]*>(.*?)</script\\s*>",
            Pattern.CASE_INSENSITIVE | Pattern.DOTALL);

    private HtmlSource() {}

    /** Bodies of every Fluxo script tag, in document order. */
    public static List<String> extractScripts(String html) {
        List<String> out = new ArrayList<>();
        if (html == null) return out;
        Matcher m = SCRIPT_TAG.matcher(html);
        while (m.find()) {
            out.add(m.group(1));
        }
        return out;
    }

    /**
     * Joins the script bodies into one program. Each body is padded with blank
     * lines so reported line numbers match the page.
     */
    public static String extractProgram(String html) {
        if (html == null) return "";
        StringBuilder sb = new StringBuilder();
        Matcher m = SCRIPT_TAG.matcher(html);
        int consumedLines = 0;
        while (m.find()) {
            int bodyLine = lineOf(html, m.start(1));
            while (consumedLines < bodyLine - 1) {
                sb.append('\n');
                consumedLines++;
            }
            String body = m.group(1);
            sb.append(body);
            consumedLines += countNewlines(body);
        }
        return sb.toString();
    }

    private static int lineOf(String s, int index) {
        return countNewlines(s.substring(0, index)) + 1;
    }

    private static int countNewlines(String s) {
        int n = 0;
        for (int i = 0; i < s.length(); i++) if (s.charAt(i) == '\n') n++;
        return n;
    }
}
