package io.mersel.services.yin.infrastructure;

/**
 * XML karakter verisi ve öznitelik değerleri için kaçış.
 * <p>
 * Karakter verisinde {@code &}, {@code <}, {@code >} ve {@code \r} entity'ye çevrilir.
 * Öznitelik değerinde ek olarak {@code "}, {@code \n} ve {@code \t} de çevrilir;
 * ayrıştırıcı öznitelik değerindeki boşluk karakterlerini normalize eder.
 * Çıktı yeniden ayrıştırıldığında özgün metin aynen elde edilir.
 */
final class XmlTextEscaper {

    private XmlTextEscaper() {}

    /**
     * Karakter verisi kaçışı.
     *
     * @return {@code null} için boş string
     */
    static String escapeText(String text) {
        return escape(text, false);
    }

    /**
     * Çift tırnakla sınırlanmış öznitelik değeri kaçışı.
     *
     * @return {@code null} için boş string
     */
    static String escapeAttribute(String value) {
        return escape(value, true);
    }

    private static String escape(String text, boolean attribute) {
        if (text == null || text.isEmpty()) {
            return "";
        }

        StringBuilder sb = null;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            String replacement = switch (c) {
                case '&' -> "&amp;";
                case '<' -> "&lt;";
                case '>' -> "&gt;";
                case '"' -> attribute ? "&quot;" : null;
                case '\r' -> "&#13;";
                case '\n' -> attribute ? "&#10;" : null;
                case '\t' -> attribute ? "&#9;" : null;
                default -> null;
            };
            if (replacement != null) {
                if (sb == null) {
                    sb = new StringBuilder(text.length() + 16);
                    sb.append(text, 0, i);
                }
                sb.append(replacement);
            } else if (sb != null) {
                sb.append(c);
            }
        }
        return sb == null ? text : sb.toString();
    }
}
