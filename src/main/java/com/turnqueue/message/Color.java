package com.turnqueue.message;

/**
 * A text color: either one of the {@link Named} colors or an arbitrary {@link Rgb} value.
 */
public sealed interface Color permits Color.Named, Color.Rgb {

    /**
     * Predefined colors. {@link #DEFAULT} leaves the choice to the renderer.
     */
    enum Named implements Color {
        DEFAULT,
        WHITE,
        GRAY,
        BLACK,
        RED,
        ORANGE,
        YELLOW,
        GREEN,
        PINK,
        BLUE
    }

    /**
     * A 24-bit color.
     *
     * @param red the red component, 0 to 255
     * @param green the green component, 0 to 255
     * @param blue the blue component, 0 to 255
     */
    record Rgb(int red, int green, int blue) implements Color {

        public Rgb {
            checkComponent("red", red);
            checkComponent("green", green);
            checkComponent("blue", blue);
        }

        private static void checkComponent(String name, int value) {
            if (value < 0 || value > 255) {
                throw new IllegalArgumentException(name + " must be between 0 and 255: " + value);
            }
        }

        @Override
        public String toString() {
            return String.format("Rgb[#%02x%02x%02x]", red, green, blue);
        }
    }

    static Color rgb(int red, int green, int blue) {
        return new Rgb(red, green, blue);
    }
}
