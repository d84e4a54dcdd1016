package dev.dettmer.vnitype.adapters.swing;

import dev.dettmer.vnitype.core.KeyState;
import dev.dettmer.vnitype.core.LogicalKey;
import dev.dettmer.vnitype.core.VniEngine;
import dev.dettmer.vnitype.core.VniTypeAdapter;
import dev.dettmer.vnitype.core.VniTypeError;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.event.InputEvent;
import java.awt.event.KeyEvent;
import java.awt.event.KeyListener;
import java.util.function.IntConsumer;
import java.util.function.IntSupplier;

import javax.swing.SwingUtilities;
import javax.swing.text.BadLocationException;
import javax.swing.text.Document;
import javax.swing.text.JTextComponent;

/**
 * Swing adapter for the VniType engine.
 *
 * <p>This adapter translates AWT key events into {@link LogicalKey} values and
 * applies the engine's edits to a Swing {@link Document}. It serves as the
 * reference implementation for how a desktop host integrates the engine.</p>
 *
 * <h3>Integration:</h3>
 * <ol>
 *   <li>Create the adapter with {@link #forComponent(JTextComponent, VniEngine)}</li>
 *   <li>Register it with {@code component.addKeyListener(adapter)}</li>
 *   <li>Typed keys reach the document through Swing's default handling; the
 *       engine runs afterwards and rewrites the word in place</li>
 * </ol>
 *
 * <h3>Swing-Specific Knowledge:</h3>
 * <ul>
 *   <li>A character reaches the document in the default handling of its
 *       {@code KEY_TYPED} event, right after the listeners run. Character
 *       keys are therefore taken from {@code keyTyped} and processed later
 *       on the event dispatch thread. This keeps the commit contract: the
 *       trigger digit is in the document when the first edit deletes it.</li>
 *   <li>Navigation and backspace keys have no typed character; they are
 *       taken from {@code keyPressed} and queued the same way, so all keys
 *       reach the engine in typing order.</li>
 *   <li>Control characters (Ctrl or Meta shortcuts, Esc, Delete) are never
 *       inserted by Swing and never enter the composition.</li>
 *   <li>Arrow, Home, End and page keys are navigation; Space, Enter and Tab
 *       are whitespace.</li>
 *   <li>{@link BadLocationException} means the document no longer matches the
 *       composition; the edit is reported as rejected.</li>
 * </ul>
 */
public class SwingVniTypeAdapter implements VniTypeAdapter, KeyListener {

    private static final Logger log = LoggerFactory.getLogger(SwingVniTypeAdapter.class);

    private final Document document;
    private final IntSupplier caretPosition;
    private final IntConsumer moveCaret;
    private final VniEngine engine;

    // Callback for surfacing delivery errors to the application
    private ErrorCallback errorCallback;

    /**
     * Callback interface for delivery errors.
     */
    public interface ErrorCallback {
        /**
         * @param error The error that occurred. Never null.
         */
        void onError(VniTypeError error);
    }

    /**
     * Create an adapter over a document and caret.
     *
     * @param document      Document receiving the edits
     * @param caretPosition Supplies the current caret offset
     * @param moveCaret     Moves the caret to an offset
     * @param engine        Engine to drive; initialized with this adapter
     */
    public SwingVniTypeAdapter(Document document, IntSupplier caretPosition,
                               IntConsumer moveCaret, VniEngine engine) {
        if (document == null || caretPosition == null || moveCaret == null || engine == null) {
            throw new IllegalArgumentException("Document, caret accessors and engine must not be null");
        }
        this.document = document;
        this.caretPosition = caretPosition;
        this.moveCaret = moveCaret;
        this.engine = engine;
        engine.init(this);
    }

    /**
     * Create an adapter editing a text component at its caret.
     */
    public static SwingVniTypeAdapter forComponent(JTextComponent component, VniEngine engine) {
        return new SwingVniTypeAdapter(component.getDocument(),
                component::getCaretPosition, component::setCaretPosition, engine);
    }

    public void setErrorCallback(ErrorCallback callback) {
        this.errorCallback = callback;
    }

    // ========================================================================
    // Key translation
    // ========================================================================

    /**
     * Translate raw AWT key data into a logical key.
     *
     * @param id        {@link KeyEvent#KEY_PRESSED}, {@link KeyEvent#KEY_TYPED} or {@link KeyEvent#KEY_RELEASED}
     * @param keyCode   Virtual key code, e.g. {@link KeyEvent#VK_LEFT}
     * @param keyChar   Produced character or {@link KeyEvent#CHAR_UNDEFINED}
     * @param modifiers Extended modifiers, e.g. {@link InputEvent#SHIFT_DOWN_MASK}
     */
    public static LogicalKey toLogicalKey(int id, int keyCode, char keyChar, int modifiers) {
        KeyState state = id == KeyEvent.KEY_RELEASED ? KeyState.RELEASE : KeyState.PRESS;
        boolean shifted = (modifiers & InputEvent.SHIFT_DOWN_MASK) != 0;
        boolean backspace = keyCode == KeyEvent.VK_BACK_SPACE;
        boolean whitespace = keyCode == KeyEvent.VK_SPACE
                || keyCode == KeyEvent.VK_ENTER
                || keyCode == KeyEvent.VK_TAB
                || (keyChar != KeyEvent.CHAR_UNDEFINED && Character.isWhitespace(keyChar));

        char character = keyChar;
        if (keyChar == KeyEvent.CHAR_UNDEFINED || backspace
                || Character.isISOControl(keyChar) || isShortcut(modifiers)) {
            character = LogicalKey.NO_CHAR;
        }
        return new LogicalKey(character, state, shifted, isNavigation(keyCode), whitespace, backspace);
    }

    /**
     * Key for a {@code KEY_PRESSED} event, or null if the key is left to
     * {@link #typedKey(char, int)}. Only navigation and backspace are taken here.
     */
    static LogicalKey pressedKey(int keyCode, int modifiers) {
        if (keyCode != KeyEvent.VK_BACK_SPACE && !isNavigation(keyCode)) {
            return null;
        }
        return toLogicalKey(KeyEvent.KEY_PRESSED, keyCode, KeyEvent.CHAR_UNDEFINED, modifiers);
    }

    /**
     * Key for a {@code KEY_TYPED} event, or null if Swing will not insert
     * anything for it.
     */
    static LogicalKey typedKey(char keyChar, int modifiers) {
        LogicalKey key = toLogicalKey(KeyEvent.KEY_TYPED, KeyEvent.VK_UNDEFINED, keyChar, modifiers);
        return key.hasCharacter() || key.whitespace ? key : null;
    }

    // Ctrl and Meta chords are shortcuts; AltGr reports Ctrl+Alt on some platforms
    private static boolean isShortcut(int modifiers) {
        if ((modifiers & InputEvent.ALT_GRAPH_DOWN_MASK) != 0) {
            return false;
        }
        return (modifiers & (InputEvent.CTRL_DOWN_MASK | InputEvent.META_DOWN_MASK)) != 0;
    }

    private static boolean isNavigation(int keyCode) {
        switch (keyCode) {
            case KeyEvent.VK_LEFT:
            case KeyEvent.VK_RIGHT:
            case KeyEvent.VK_UP:
            case KeyEvent.VK_DOWN:
            case KeyEvent.VK_KP_LEFT:
            case KeyEvent.VK_KP_RIGHT:
            case KeyEvent.VK_KP_UP:
            case KeyEvent.VK_KP_DOWN:
            case KeyEvent.VK_HOME:
            case KeyEvent.VK_END:
            case KeyEvent.VK_PAGE_UP:
            case KeyEvent.VK_PAGE_DOWN:
                return true;
            default:
                return false;
        }
    }

    /**
     * Run a key through the engine. The key must already be committed to the
     * document.
     *
     * @return true if the engine rewrote the word
     */
    public boolean onKey(LogicalKey key) {
        return engine.processKey(key);
    }

    // ========================================================================
    // KeyListener implementation
    // ========================================================================

    @Override
    public void keyPressed(KeyEvent e) {
        LogicalKey key = pressedKey(e.getKeyCode(), e.getModifiersEx());
        if (key != null) {
            SwingUtilities.invokeLater(() -> onKey(key));
        }
    }

    @Override
    public void keyTyped(KeyEvent e) {
        LogicalKey key = typedKey(e.getKeyChar(), e.getModifiersEx());
        if (key != null) {
            // let Swing insert the typed character first
            SwingUtilities.invokeLater(() -> onKey(key));
        }
    }

    @Override
    public void keyReleased(KeyEvent e) {
        // the engine ignores releases
    }

    // ========================================================================
    // VniTypeAdapter implementation
    // ========================================================================

    @Override
    public boolean deleteBeforeCursor(int count) {
        int caret = caretPosition.getAsInt();
        if (count > caret) {
            log.warn("Cannot delete {} characters before caret at {}", count, caret);
            return false;
        }
        try {
            document.remove(caret - count, count);
            moveCaret.accept(caret - count);
            return true;
        } catch (BadLocationException e) {
            log.error("Delete of {} before {} failed", count, caret, e);
            return false;
        }
    }

    @Override
    public boolean insert(char character) {
        int caret = caretPosition.getAsInt();
        try {
            document.insertString(caret, String.valueOf(character), null);
            moveCaret.accept(caret + 1);
            return true;
        } catch (BadLocationException e) {
            log.error("Insert of '{}' at {} failed", character, caret, e);
            return false;
        }
    }

    @Override
    public void onError(VniTypeError error) {
        log.warn("VniType error [{}]: {}", error.code, error.message);
        if (errorCallback != null) {
            errorCallback.onError(error);
        }
    }
}
