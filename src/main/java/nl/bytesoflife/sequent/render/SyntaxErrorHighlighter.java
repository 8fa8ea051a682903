package nl.bytesoflife.sequent.render;

/**
 * Marks the character at a syntax error position with {@code <u>}. An error at the end
 * of the input underlines a trailing blank instead.
 */
public class SyntaxErrorHighlighter {

    public String highlight(String input, int position) {
        if (position < 0 || position > input.length()) {
            throw new IllegalArgumentException("Position " + position + " outside input of length " + input.length());
        }
        StringBuilder sb = new StringBuilder();
        sb.append(Html.escape(input.substring(0, position)));
        sb.append("<u>");
        if (position < input.length()) {
            sb.append(Html.escape(input.substring(position, position + 1)));
            sb.append("</u>");
            sb.append(Html.escape(input.substring(position + 1)));
        } else {
            sb.append(" </u>");
        }
        return sb.toString();
    }
}
