package dev.dettmer.vnitype.core;

import java.util.Collections;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Main entry point: turns key events into edits of the host text field.
 *
 * <p>Digits 1 to 5 add tone marks, 6 to 9 add circumflex, horn, breve and the
 * crossed d. Every other printable key is appended to the composition
 * buffer; whitespace and navigation clear it; backspace removes its last
 * character.</p>
 *
 * <h3>Usage:</h3>
 * <pre>{@code
 * VniEngine engine = new VniEngine();
 * engine.init(myAdapter);
 *
 * // For every key event, after the host committed the key to the field:
 * engine.processKey(LogicalKey.press('6'));
 * // Edits delivered via adapter.deleteBeforeCursor() / adapter.insert()
 * }</pre>
 *
 * <p>{@link #handleKey(LogicalKey)} is the pure variant: it returns the
 * operations instead of delivering them.</p>
 *
 * <p>Thread safety: none. An engine holds one composition and must be
 * driven from a single thread.</p>
 */
public class VniEngine {

    private static final Logger log = LoggerFactory.getLogger(VniEngine.class);

    private final CompositionBuffer buffer = new CompositionBuffer();
    private final VniOptions options;
    private final DiacriticMatcher diacriticMatcher;
    private final AccentApplier accentApplier;

    private VniTypeAdapter adapter;

    public VniEngine() {
        this(VniOptions.defaults());
    }

    /**
     * @param options Engine options. Must not be null.
     */
    public VniEngine(VniOptions options) {
        if (options == null) {
            throw new IllegalArgumentException("VniOptions must not be null");
        }
        this.options = options;
        EditSynthesizer synthesizer = new EditSynthesizer(options.hostCommitsTriggerKey);
        this.diacriticMatcher = new DiacriticMatcher(synthesizer);
        this.accentApplier = new AccentApplier(new VowelSelector(), synthesizer);
    }

    // ========================================================================
    // Key dispatch
    // ========================================================================

    /**
     * Process one key event and update the composition.
     *
     * @param key Key event. Must not be null.
     * @return operations to apply to the host field; empty means the key
     *         passes through unchanged
     * @throws IllegalArgumentException if key is null
     */
    public List<EditOperation> handleKey(LogicalKey key) {
        if (key == null) {
            throw new IllegalArgumentException("LogicalKey must not be null");
        }
        if (!key.isPress()) {
            return Collections.emptyList();
        }

        List<EditOperation> ops = Collections.emptyList();
        if (key.navigation || key.whitespace) {
            buffer.clear();
        } else if (key.backspace) {
            buffer.pop();
        } else if (key.hasCharacter()) {
            char ch = key.shifted ? Character.toUpperCase(key.character) : key.character;
            ops = dispatchTrigger(ch);
            if (ops.isEmpty()) {
                buffer.append(ch);
            }
        }

        if (log.isDebugEnabled()) {
            log.debug("{} -> buffer \"{}\", ops {}", key, buffer, ops);
        }
        return ops;
    }

    private List<EditOperation> dispatchTrigger(char ch) {
        DiacriticMark mark = DiacriticMark.fromTrigger(ch);
        if (mark != null) {
            return diacriticMatcher.apply(buffer, mark.rules);
        }
        ToneMark tone = ToneMark.fromTrigger(ch);
        if (tone != null) {
            return accentApplier.apply(buffer, tone);
        }
        return Collections.emptyList();
    }

    // ========================================================================
    // Adapter delivery
    // ========================================================================

    /**
     * Attach the host adapter used by {@link #processKey(LogicalKey)}.
     *
     * @param adapter Adapter implementation. Must not be null.
     * @throws IllegalArgumentException if adapter is null
     */
    public void init(VniTypeAdapter adapter) {
        if (adapter == null) {
            throw new IllegalArgumentException("VniTypeAdapter must not be null");
        }
        this.adapter = adapter;
        log.info("VniEngine initialized ({})", options);
    }

    /** @return true once {@link #init(VniTypeAdapter)} has been called. */
    public boolean isInitialized() {
        return adapter != null;
    }

    /**
     * Process one key event and deliver the resulting edits to the adapter.
     *
     * <p>Delivery stops at the first operation the adapter rejects. The
     * adapter is then told via {@link VniTypeAdapter#onError} and the
     * composition is cleared.</p>
     *
     * @param key Key event. Must not be null.
     * @return true if edits were delivered, false if the key passes through
     * @throws IllegalStateException if called before init()
     */
    public boolean processKey(LogicalKey key) {
        if (adapter == null) {
            throw new IllegalStateException("processKey called before init()");
        }

        List<EditOperation> ops = handleKey(key);
        if (ops.isEmpty()) {
            return false;
        }

        for (EditOperation op : ops) {
            boolean ok = op.isDelete()
                    ? adapter.deleteBeforeCursor(op.count)
                    : adapter.insert(op.character);
            if (!ok) {
                VniTypeError error = op.isDelete()
                        ? VniTypeError.DELETE_REJECTED
                        : VniTypeError.INSERT_REJECTED;
                log.warn("{} while applying {}; composition \"{}\" dropped", error.message, op, buffer);
                buffer.clear();
                adapter.onError(error);
                return false;
            }
        }
        return true;
    }

    /** Forget the current composition, e.g. when the host field loses focus. */
    public void reset() {
        buffer.clear();
    }

    /** @return the current composition. */
    public String getComposition() {
        return buffer.toString();
    }

    public VniOptions getOptions() {
        return options;
    }
}
