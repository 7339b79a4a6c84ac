package net.grammex.util;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class Formats {

    /* Everything that is not printable ASCII or that needs escaping. */
    private static final Pattern ESCAPE = Pattern.compile(
        "[^ !#-&(-\\[\\]-~]");

    // Prevent construction.
    private Formats() {}

    public static String escape(CharSequence data) {
        Matcher m = ESCAPE.matcher(data);
        StringBuffer sb = new StringBuffer();
        while (m.find()) {
            int ch = m.group().charAt(0);
            String repl;
            switch (ch) {
                case '\n': repl = "\\\\n"; break;
                case '\r': repl = "\\\\r"; break;
                case '\t': repl = "\\\\t"; break;
                case '"': repl = "\\\\\""; break;
                case '\'': repl = "\\\\'"; break;
                case '\\': repl = "\\\\\\\\"; break;
                default:
                    repl = String.format((ch < 256) ? "\\\\x%02x" :
                                         "\\\\u%04x", ch);
                    break;
            }
            m.appendReplacement(sb, repl);
        }
        m.appendTail(sb);
        return sb.toString();
    }

    public static String formatString(CharSequence s) {
        if (s == null) return "null";
        return '"' + escape(s) + '"';
    }

    public static String formatChar(char ch) {
        return "'" + escape(String.valueOf(ch)) + "'";
    }

    public static String formatElement(Object o) {
        if (o instanceof Character) return formatChar((Character) o);
        if (o instanceof CharSequence) return formatString((CharSequence) o);
        if (o instanceof Byte) return formatBytes(new byte[] { (Byte) o });
        return String.valueOf(o);
    }

    public static String formatBytes(byte[] data) {
        StringBuilder sb = new StringBuilder("<");
        for (int i = 0; i < data.length; i++) {
            if (i != 0) sb.append(' ');
            sb.append(String.format("%02x", data[i] & 0xFF));
        }
        return sb.append('>').toString();
    }

    /* Shorten s to at most maxLength characters, marking the cut with
     * an ellipsis. */
    public static String abbreviate(CharSequence s, int maxLength) {
        if (s.length() <= maxLength) return s.toString();
        if (maxLength <= 3) return s.subSequence(0, maxLength).toString();
        return s.subSequence(0, maxLength - 3).toString() + "...";
    }

}
