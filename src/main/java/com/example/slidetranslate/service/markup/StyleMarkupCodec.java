package com.example.slidetranslate.service.markup;

import com.example.slidetranslate.dto.translation.RunColor;
import com.example.slidetranslate.dto.translation.StyledRun;

import java.math.BigDecimal;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Converts styled runs to a compact tagged string and back.
 *
 * <p>Markup vocabulary, outermost first: {@code <sz v="12">} font size in points,
 * {@code <c v="#RRGGBB">} or {@code <c v="theme:5:-0.25">} color, then
 * {@code <b>}, {@code <i>}, {@code <u>}, {@code <s>}. {@code <sp/>} carries one
 * whitespace character at a run boundary and {@code <br/>} a hard line break.
 *
 * <p>Decoding is tolerant: the input has been through a language model, so unknown
 * tags, stray close tags and unclosed tags are absorbed instead of rejected.
 */
public final class StyleMarkupCodec {

    public static final String SPACE_TOKEN = "<sp/>";
    public static final String BREAK_TOKEN = "<br/>";

    private static final Pattern TAG_PATTERN = Pattern.compile(
        "<(/)?([a-zA-Z][a-zA-Z0-9]*)((?:\\s+[a-zA-Z_:][-a-zA-Z0-9_:.]*(?:\\s*=\\s*(?:\"[^\"]*\"|'[^']*'|[^\\s\"'>/]+))?)*)\\s*(/)?\\s*>");
    private static final Pattern ATTRIBUTE_PATTERN = Pattern.compile(
        "([a-zA-Z_:][-a-zA-Z0-9_:.]*)(?:\\s*=\\s*(?:\"([^\"]*)\"|'([^']*)'|([^\\s\"'>/]+)))?");
    private static final Pattern ENTITY_PATTERN = Pattern.compile("&(#[0-9]{1,7}|#[xX][0-9a-fA-F]{1,6}|[a-zA-Z]{2,8});");
    private static final Pattern HEX_COLOR = Pattern.compile("#?([0-9a-fA-F]{6})");
    private static final Pattern THEME_COLOR = Pattern.compile("theme:(\\d{1,3})(?::(-?\\d+(?:\\.\\d+)?))?");
    private static final Pattern FONT_SIZE = Pattern.compile("(\\d+(?:\\.\\d+)?)\\s*(?:pt)?");
    private static final Pattern LINE_TERMINATOR = Pattern.compile("\\R");

    private static final Map<String, String> NAMED_ENTITIES = new HashMap<>();

    static {
        NAMED_ENTITIES.put("amp", "&");
        NAMED_ENTITIES.put("lt", "<");
        NAMED_ENTITIES.put("gt", ">");
        NAMED_ENTITIES.put("quot", "\"");
        NAMED_ENTITIES.put("apos", "'");
        NAMED_ENTITIES.put("nbsp", "\u00A0");
    }

    private StyleMarkupCodec() {
    }

    // ---------------------------------------------------------------- encode

    public static String encode(List<StyledRun> runs) {
        StringBuilder markup = new StringBuilder();
        if (runs == null) {
            return "";
        }
        for (StyledRun run : runs) {
            appendRun(markup, run);
        }
        return markup.toString();
    }

    private static void appendRun(StringBuilder markup, StyledRun run) {
        if (run == null || run.getText() == null || run.getText().isEmpty()) {
            return;
        }
        String body = run.isLineBreak() ? BREAK_TOKEN : encodeText(run.getText());
        if (body.isEmpty()) {
            return;
        }

        StringBuilder close = new StringBuilder();
        if (run.getFontSizePt() != null) {
            markup.append("<sz v=\"").append(formatNumber(run.getFontSizePt())).append("\">");
            close.insert(0, "</sz>");
        }
        if (run.getColor() != null) {
            markup.append("<c v=\"").append(formatColor(run.getColor())).append("\">");
            close.insert(0, "</c>");
        }
        if (run.isBold()) {
            markup.append("<b>");
            close.insert(0, "</b>");
        }
        if (run.isItalic()) {
            markup.append("<i>");
            close.insert(0, "</i>");
        }
        if (run.isUnderline()) {
            markup.append("<u>");
            close.insert(0, "</u>");
        }
        if (run.isStrike()) {
            markup.append("<s>");
            close.insert(0, "</s>");
        }
        markup.append(body).append(close);
    }

    private static String encodeText(String text) {
        // any line terminator would split the batch line it is sent in
        String normalized = LINE_TERMINATOR.matcher(text).replaceAll("\n");
        String[] lines = normalized.split("\n", -1);
        StringBuilder out = new StringBuilder();
        for (int i = 0; i < lines.length; i++) {
            if (i > 0) {
                out.append(BREAK_TOKEN);
            }
            appendLine(out, lines[i]);
        }
        return out.toString();
    }

    private static void appendLine(StringBuilder out, String line) {
        int start = 0;
        int end = line.length();
        while (start < end && Character.isWhitespace(line.charAt(start))) {
            start++;
        }
        while (end > start && Character.isWhitespace(line.charAt(end - 1))) {
            end--;
        }
        out.append(SPACE_TOKEN.repeat(start));
        out.append(escape(line.substring(start, end)));
        out.append(SPACE_TOKEN.repeat(line.length() - end));
    }

    static String escape(String text) {
        StringBuilder out = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char ch = text.charAt(i);
            switch (ch) {
                case '&':
                    out.append("&amp;");
                    break;
                case '<':
                    out.append("&lt;");
                    break;
                case '>':
                    out.append("&gt;");
                    break;
                case '"':
                    out.append("&quot;");
                    break;
                default:
                    out.append(ch);
            }
        }
        return out.toString();
    }

    private static String formatColor(RunColor color) {
        if (color.isTheme()) {
            String value = "theme:" + color.getThemeId();
            if (color.getBrightness() != null && color.getBrightness() != 0.0) {
                value += ":" + formatNumber(color.getBrightness());
            }
            return value;
        }
        return "#" + color.getRgb();
    }

    static String formatNumber(double value) {
        if (value == Math.rint(value) && !Double.isInfinite(value)) {
            return Long.toString((long) value);
        }
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

    // ---------------------------------------------------------------- decode

    public static List<StyledRun> decode(String markup) {
        RunCollector runs = new RunCollector();
        if (markup == null || markup.isEmpty()) {
            return runs.result();
        }

        Deque<Frame> stack = new ArrayDeque<>();
        StyledRun style = StyledRun.plain("");
        StringBuilder text = new StringBuilder();
        Matcher tag = TAG_PATTERN.matcher(markup);
        int length = markup.length();
        int i = 0;

        while (i < length) {
            char ch = markup.charAt(i);
            if (ch == '<') {
                tag.region(i, length);
                if (!tag.lookingAt()) {
                    text.append(ch);
                    i++;
                    continue;
                }
                runs.addText(text, style);
                String name = tag.group(2).toLowerCase(Locale.ROOT);
                boolean closing = tag.group(1) != null;
                boolean selfClosing = tag.group(4) != null;

                if (closing) {
                    style = closeTag(stack, name, style);
                } else if ("sp".equals(name)) {
                    runs.addToken(" ", style);
                } else if ("br".equals(name)) {
                    runs.addToken(StyledRun.LINE_BREAK, style);
                } else if (!selfClosing) {
                    stack.push(new Frame(name, style));
                    style = applyTag(style, name, parseAttributes(tag.group(3)));
                }
                i = tag.end();
            } else if (ch == '&') {
                Matcher entity = ENTITY_PATTERN.matcher(markup).region(i, length);
                String decoded = entity.lookingAt() ? decodeEntity(entity.group(1)) : null;
                if (decoded != null) {
                    text.append(decoded);
                    i = entity.end();
                } else {
                    text.append(ch);
                    i++;
                }
            } else if (ch == '\n' || ch == '\r') {
                // literal newlines are model noise; collapse them with neighbouring blanks
                while (text.length() > 0 && isBlank(text.charAt(text.length() - 1))) {
                    text.setLength(text.length() - 1);
                }
                while (i < length && (isBlank(markup.charAt(i)) || markup.charAt(i) == '\n' || markup.charAt(i) == '\r')) {
                    i++;
                }
                text.append(' ');
            } else {
                text.append(ch);
                i++;
            }
        }
        runs.addText(text, style);
        return runs.result();
    }

    private static boolean isBlank(char ch) {
        return ch == ' ' || ch == '\t';
    }

    private static StyledRun closeTag(Deque<Frame> stack, String name, StyledRun current) {
        String canonical = canonicalName(name);
        boolean open = stack.stream().anyMatch(frame -> canonicalName(frame.tag).equals(canonical));
        if (!open) {
            return current;
        }
        StyledRun restored = current;
        while (!stack.isEmpty()) {
            Frame frame = stack.pop();
            restored = frame.saved;
            if (canonicalName(frame.tag).equals(canonical)) {
                break;
            }
        }
        return restored;
    }

    private static StyledRun applyTag(StyledRun current, String name, Map<String, String> attributes) {
        StyledRun next = current.withText("");
        switch (canonicalName(name)) {
            case "b":
                next.setBold(true);
                break;
            case "i":
                next.setItalic(true);
                break;
            case "u":
                next.setUnderline(true);
                break;
            case "s":
                next.setStrike(true);
                break;
            case "sz":
                Double size = parseSize(firstPresent(attributes, "v", "size", "val"));
                if (size != null) {
                    next.setFontSizePt(size);
                }
                break;
            case "c":
                RunColor color = parseColor(firstPresent(attributes, "v", "color", "val"));
                if (color != null) {
                    next.setColor(color);
                }
                break;
            case "span":
                applyInlineStyle(next, attributes.get("style"));
                break;
            default:
                // unknown element: scoped, but style-neutral
        }
        return next;
    }

    private static String canonicalName(String name) {
        switch (name) {
            case "strong":
                return "b";
            case "em":
                return "i";
            case "ins":
                return "u";
            case "strike":
            case "del":
                return "s";
            case "size":
                return "sz";
            case "color":
            case "font":
                return "c";
            default:
                return name;
        }
    }

    private static void applyInlineStyle(StyledRun style, String css) {
        if (css == null) {
            return;
        }
        for (String declaration : css.split(";")) {
            int colon = declaration.indexOf(':');
            if (colon < 0) {
                continue;
            }
            String key = declaration.substring(0, colon).trim().toLowerCase(Locale.ROOT);
            String value = declaration.substring(colon + 1).trim();
            if ("font-size".equals(key)) {
                Double size = parseSize(value);
                if (size != null) {
                    style.setFontSizePt(size);
                }
            } else if ("color".equals(key)) {
                RunColor color = parseColor(value);
                if (color != null) {
                    style.setColor(color);
                }
            }
        }
    }

    private static String firstPresent(Map<String, String> attributes, String... names) {
        for (String name : names) {
            String value = attributes.get(name);
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    private static Map<String, String> parseAttributes(String source) {
        Map<String, String> attributes = new HashMap<>();
        if (source == null || source.isBlank()) {
            return attributes;
        }
        Matcher matcher = ATTRIBUTE_PATTERN.matcher(source);
        while (matcher.find()) {
            String value = matcher.group(2) != null ? matcher.group(2)
                : matcher.group(3) != null ? matcher.group(3)
                : matcher.group(4);
            attributes.put(matcher.group(1).toLowerCase(Locale.ROOT), value == null ? "" : unescapeAttribute(value));
        }
        return attributes;
    }

    private static String unescapeAttribute(String value) {
        Matcher entity = ENTITY_PATTERN.matcher(value);
        StringBuilder out = new StringBuilder();
        while (entity.find()) {
            String decoded = decodeEntity(entity.group(1));
            entity.appendReplacement(out, Matcher.quoteReplacement(decoded != null ? decoded : entity.group()));
        }
        entity.appendTail(out);
        return out.toString();
    }

    static Double parseSize(String value) {
        if (value == null) {
            return null;
        }
        Matcher matcher = FONT_SIZE.matcher(value.trim().toLowerCase(Locale.ROOT));
        if (!matcher.matches()) {
            return null;
        }
        double size = Double.parseDouble(matcher.group(1));
        return size > 0 ? size : null;
    }

    static RunColor parseColor(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim().toLowerCase(Locale.ROOT);
        Matcher hex = HEX_COLOR.matcher(trimmed);
        if (hex.matches()) {
            return RunColor.rgb(hex.group(1));
        }
        Matcher theme = THEME_COLOR.matcher(trimmed);
        if (theme.matches()) {
            Double brightness = theme.group(2) != null ? Double.valueOf(theme.group(2)) : null;
            return RunColor.theme(Integer.parseInt(theme.group(1)), brightness);
        }
        return null;
    }

    private static String decodeEntity(String body) {
        if (body.startsWith("#")) {
            try {
                int codePoint = body.length() > 1 && (body.charAt(1) == 'x' || body.charAt(1) == 'X')
                    ? Integer.parseInt(body.substring(2), 16)
                    : Integer.parseInt(body.substring(1));
                return Character.isValidCodePoint(codePoint) ? new String(Character.toChars(codePoint)) : null;
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return NAMED_ENTITIES.get(body.toLowerCase(Locale.ROOT));
    }

    private static final class Frame {
        private final String tag;
        private final StyledRun saved;

        private Frame(String tag, StyledRun saved) {
            this.tag = tag;
            this.saved = saved;
        }
    }

    /**
     * Accumulates decoded runs. Plain text merges into the previous text run of the
     * same style; space and break tokens always stand alone.
     */
    private static final class RunCollector {
        private final List<StyledRun> runs = new ArrayList<>();
        private boolean lastIsToken;

        void addText(StringBuilder buffer, StyledRun style) {
            if (buffer.length() == 0) {
                return;
            }
            String text = buffer.toString();
            buffer.setLength(0);
            StyledRun last = runs.isEmpty() ? null : runs.get(runs.size() - 1);
            if (last != null && !lastIsToken && last.hasSameStyle(style)) {
                last.setText(last.getText() + text);
                return;
            }
            runs.add(style.withText(text));
            lastIsToken = false;
        }

        void addToken(String text, StyledRun style) {
            runs.add(style.withText(text));
            lastIsToken = true;
        }

        List<StyledRun> result() {
            return runs;
        }
    }
}
