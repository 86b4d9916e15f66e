package com.turnqueue.message;

import java.util.Objects;

/**
 * A run of literal text with formatting.
 *
 * @param bold whether the text is bold
 * @param italic whether the text is italic
 * @param color the foreground color
 * @param backgroundColor the background color
 * @param text the literal text
 */
public record Text(boolean bold, boolean italic, Color color, Color backgroundColor, String text) {

    public Text {
        Objects.requireNonNull(color, "color");
        Objects.requireNonNull(backgroundColor, "backgroundColor");
        Objects.requireNonNull(text, "text");
    }

    /**
     * Plain text in the default colors.
     */
    public static Text normal(String text) {
        return new Text(false, false, Color.Named.DEFAULT, Color.Named.DEFAULT, text);
    }

    /**
     * Bold text in the default colors.
     */
    public static Text bold(String text) {
        return new Text(true, false, Color.Named.DEFAULT, Color.Named.DEFAULT, text);
    }

    /**
     * Italic text in the default colors.
     */
    public static Text italic(String text) {
        return new Text(false, true, Color.Named.DEFAULT, Color.Named.DEFAULT, text);
    }

    /**
     * Plain text in the given foreground color and the default background.
     */
    public static Text colored(String text, Color color) {
        return new Text(false, false, color, Color.Named.DEFAULT, text);
    }

    @Override
    public String toString() {
        return text;
    }
}
