// file: format/src/main/java/io/sumspec/format/html/Html.java
package io.sumspec.format.html;

/**
 * HTML text helpers.
 */
final class Html {

    private Html() {
        // utility
    }

    static String escape(String s) {
        var out = new StringBuilder(s.length() + 16);
        for (char c : s.toCharArray()) {
            switch (c) {
                case '&' -> out.append("&amp;");
                case '<' -> out.append("&lt;");
                case '>' -> out.append("&gt;");
                case '"' -> out.append("&quot;");
                case '\'' -> out.append("&#39;");
                default -> out.append(c);
            }
        }
        return out.toString();
    }

    /** Escaped text inside {@code tag}, with an optional class. */
    static String tag(String tag, String cssClass, String innerHtml) {
        String cls = cssClass == null ? "" : " class=\"" + escape(cssClass) + "\"";
        return "<" + tag + cls + ">" + innerHtml + "</" + tag + ">";
    }
}
