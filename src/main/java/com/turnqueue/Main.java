package com.turnqueue;

import com.turnqueue.engine.SimulationLoop;
import com.turnqueue.entities.Messenger;
import com.turnqueue.entities.RepeatingMessenger;
import com.turnqueue.message.Color;
import com.turnqueue.message.Message;
import com.turnqueue.message.Text;

import java.io.IOException;
import java.io.InputStream;
import java.util.OptionalLong;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * Main entry point running a short scripted simulation on the update queue.
 */
public class Main {

    static {
        try (InputStream is = Main.class.getResourceAsStream("/logging.properties")) {
            if (is != null) {
                LogManager.getLogManager().readConfiguration(is);
            }
        } catch (IOException e) {
            Logger.getLogger(Main.class.getName())
                    .log(Level.WARNING, "Could not read logging.properties, using defaults", e);
        }
    }

    private static final Logger logger = Logger.getLogger(Main.class.getName());

    public static void main(String[] args) {
        runMessengerDemo();
    }

    /**
     * Schedules a few message emitters, cancels one of them, and logs every message in the order
     * the queue produced it.
     */
    public static void runMessengerDemo() {
        logger.info("=== Messenger Demo ===");

        SimulationLoop loop = new SimulationLoop(message -> logger.info(message.plainText()));

        Messenger greeting = new Messenger(Message.normal(
                Text.normal("Message from"),
                Text.bold("Jessie"),
                Text.normal(":"),
                Text.italic("Hello!")));
        RepeatingMessenger heartbeat = new RepeatingMessenger(Message.normal(
                Text.colored("heartbeat", Color.rgb(255, 64, 64))), 5, 4);
        Messenger cancelled = new Messenger(Message.normal(Text.normal("This is never shown")));

        loop.schedule(0, greeting);
        loop.schedule(1, heartbeat);
        loop.schedule(7, cancelled);
        cancelled.deactivate();

        // Everything up to tick 10 first, then the rest
        int firstBatch = loop.runUntil(10);
        logger.info("Processed " + firstBatch + " updates up to tick 10");

        int secondBatch = loop.runToCompletion();
        OptionalLong lastTick = loop.currentTick();
        logger.info("Processed " + secondBatch + " more updates, last tick "
                + (lastTick.isPresent() ? lastTick.getAsLong() : "none"));
    }
}
