package io.mersel.services.yin.infrastructure;

/**
 * YIN belgesinin bellekte üretildiği tampon.
 * <p>
 * Her satır derinlik başına iki boşlukla girintilenir ve {@code \n} ile biter.
 * Derinlik çağıranlar tarafından parametre olarak taşınır; tampon yalnızca metni biriktirir.
 * Tüm öznitelik değerleri ve metin blokları {@link XmlTextEscaper} üzerinden geçer.
 */
final class YinOutput {

    private final StringBuilder buffer = new StringBuilder(4096);

    /**
     * {@code <elem attr="value">} veya {@code close} ise {@code <elem attr="value"/>}.
     */
    void open(int level, String elem, String attr, String value, boolean close) {
        indent(level);
        buffer.append('<').append(elem).append(' ').append(attr).append("=\"")
                .append(XmlTextEscaper.escapeAttribute(value))
                .append(close ? "\"/>\n" : "\">\n");
    }

    /** Özniteliksiz {@code <elem>} veya {@code close} ise {@code <elem/>}. */
    void open(int level, String elem, boolean close) {
        indent(level);
        buffer.append('<').append(elem).append(close ? "/>\n" : ">\n");
    }

    void close(int level, String elem) {
        indent(level);
        buffer.append("</").append(elem).append(">\n");
    }

    /** Tek öznitelikli, kendi kendine kapanan sayısal eleman ({@code min-elements}, {@code position} vb.). */
    void number(int level, String elem, String attr, long value) {
        indent(level);
        buffer.append('<').append(elem).append(' ').append(attr).append("=\"")
                .append(value).append("\"/>\n");
    }

    /**
     * Metin bloğu: {@code <elem><inner>…</inner></elem>}, {@code inner} ayrı satırda.
     */
    void text(int level, String elem, String inner, String text) {
        open(level, elem, false);
        indent(level + 1);
        buffer.append('<').append(inner).append('>')
                .append(XmlTextEscaper.escapeText(text))
                .append("</").append(inner).append(">\n");
        close(level, elem);
    }

    /** Ham satır; girinti ve kaçış uygulanmaz. */
    void line(String raw) {
        buffer.append(raw).append('\n');
    }

    /** Ham metin; satır sonu eklenmez. */
    void raw(String raw) {
        buffer.append(raw);
    }

    void indent(int level) {
        for (int i = 0; i < level * 2; i++) {
            buffer.append(' ');
        }
    }

    @Override
    public String toString() {
        return buffer.toString();
    }
}
