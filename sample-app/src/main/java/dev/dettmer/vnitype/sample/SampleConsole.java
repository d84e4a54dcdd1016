package dev.dettmer.vnitype.sample;

import dev.dettmer.vnitype.core.LogicalKey;
import dev.dettmer.vnitype.core.VniEngine;
import dev.dettmer.vnitype.core.VniOptions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Properties;

/**
 * Console demo for the VniType engine.
 *
 * <p>Each input line is a {@link KeyScript}; it is typed into a fresh
 * {@link ConsoleTextField} and the resulting text is printed:</p>
 *
 * <pre>
 *   $ echo "Tie61ng Vie65t" | java -jar vnitype-sample-app.jar
 *   Tiếng Việt
 * </pre>
 *
 * <p>Arguments, when given, are used instead of standard input.
 * Options come from {@code vnitype.properties} on the classpath, overridden
 * by system properties of the same name.</p>
 */
public class SampleConsole {

    private static final Logger log = LoggerFactory.getLogger(SampleConsole.class);
    private static final String OPTIONS_RESOURCE = "/vnitype.properties";

    private final ConsoleTextField field;

    public SampleConsole(VniOptions options) {
        this.field = new ConsoleTextField(new VniEngine(options));
    }

    /**
     * Type one script line into an empty field.
     *
     * @return the field's text afterwards
     */
    public String typeLine(String line) {
        field.clear();
        for (LogicalKey key : KeyScript.parse(line)) {
            field.type(key);
        }
        return field.getText();
    }

    public static void main(String[] args) throws IOException {
        SampleConsole console = new SampleConsole(loadOptions());
        PrintStream out = new PrintStream(System.out, true, StandardCharsets.UTF_8);

        if (args.length > 0) {
            for (String arg : args) {
                out.println(console.typeLine(arg));
            }
            return;
        }

        try (BufferedReader in = new BufferedReader(
                new InputStreamReader(System.in, StandardCharsets.UTF_8))) {
            String line;
            while ((line = in.readLine()) != null) {
                out.println(console.typeLine(line));
            }
        }
    }

    static VniOptions loadOptions() {
        Properties props = new Properties();
        try (InputStream is = SampleConsole.class.getResourceAsStream(OPTIONS_RESOURCE)) {
            if (is != null) {
                props.load(new InputStreamReader(is, StandardCharsets.UTF_8));
            } else {
                log.warn("{} not found, using defaults", OPTIONS_RESOURCE);
            }
        } catch (IOException e) {
            log.warn("Failed to read {}: {}", OPTIONS_RESOURCE, e.getMessage());
        }

        String override = System.getProperty(VniOptions.HOST_COMMITS_TRIGGER_KEY);
        if (override != null) {
            props.setProperty(VniOptions.HOST_COMMITS_TRIGGER_KEY, override);
        }

        VniOptions options = VniOptions.fromProperties(props);
        log.info("Loaded {}", options);
        return options;
    }
}
