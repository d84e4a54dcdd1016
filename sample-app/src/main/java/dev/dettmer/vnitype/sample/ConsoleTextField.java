package dev.dettmer.vnitype.sample;

import dev.dettmer.vnitype.core.LogicalKey;
import dev.dettmer.vnitype.core.VniEngine;
import dev.dettmer.vnitype.core.VniTypeAdapter;
import dev.dettmer.vnitype.core.VniTypeError;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A minimal text field host that drives the engine.
 *
 * <p>Like a real input field it commits every key first (trigger digits
 * included), then lets the engine rewrite the word. When the engine is
 * configured with {@code hostCommitsTriggerKey=false} the field asks the
 * engine first and commits only keys the engine passed through. The cursor sits at the
 * end of the text, except that navigation keys move it and let the next
 * characters go in the middle.</p>
 */
public class ConsoleTextField implements VniTypeAdapter {

    private static final Logger log = LoggerFactory.getLogger(ConsoleTextField.class);

    private final StringBuilder text = new StringBuilder();
    private final VniEngine engine;
    private int cursor;
    private int errorCount;

    public ConsoleTextField(VniEngine engine) {
        this.engine = engine;
        engine.init(this);
    }

    /**
     * Commit a key to the field and run it through the engine.
     */
    public void type(LogicalKey key) {
        if (engine.getOptions().hostCommitsTriggerKey) {
            commit(key);
            if (engine.processKey(key)) {
                log.debug("Rewritten: \"{}\"", text);
            }
        } else if (engine.processKey(key)) {
            log.debug("Consumed {}, rewritten: \"{}\"", key, text);
        } else {
            commit(key);
        }
    }

    private void commit(LogicalKey key) {
        if (!key.isPress()) return;
        if (key.backspace) {
            if (cursor > 0) {
                text.deleteCharAt(--cursor);
            }
        } else if (key.navigation) {
            // the sample script has no direction, so navigation jumps to the start of the field
            cursor = 0;
        } else if (key.hasCharacter()) {
            char c = key.shifted ? Character.toUpperCase(key.character) : key.character;
            text.insert(cursor++, c);
        }
    }

    /** Empty the field and the engine's composition. */
    public void clear() {
        text.setLength(0);
        cursor = 0;
        engine.reset();
    }

    public String getText() {
        return text.toString();
    }

    public int getErrorCount() {
        return errorCount;
    }

    // -----------------------------------------------------------------------
    // VniTypeAdapter implementation
    // -----------------------------------------------------------------------

    @Override
    public boolean deleteBeforeCursor(int count) {
        if (count > cursor) return false;
        text.delete(cursor - count, cursor);
        cursor -= count;
        return true;
    }

    @Override
    public boolean insert(char character) {
        text.insert(cursor++, character);
        return true;
    }

    @Override
    public void onError(VniTypeError error) {
        errorCount++;
        log.error("VniType error [{}]: {}", error.code, error.message);
    }
}
