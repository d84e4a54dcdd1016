package dev.dettmer.vnitype.core;

import java.util.Collections;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies tone triggers: selects the vowel, looks up its toned form and
 * rewrites that one position.
 *
 * <p>A vowel that already has a tone gets the new tone instead.</p>
 */
public final class AccentApplier {

    private static final Logger log = LoggerFactory.getLogger(AccentApplier.class);

    private final VowelSelector selector;
    private final EditSynthesizer synthesizer;

    public AccentApplier(VowelSelector selector, EditSynthesizer synthesizer) {
        this.selector = selector;
        this.synthesizer = synthesizer;
    }

    /**
     * @return edit operations for the rewrite, empty if no vowel can carry the tone
     */
    public List<EditOperation> apply(CompositionBuffer buffer, ToneMark tone) {
        VowelSelector.Selection selection = selector.select(buffer);
        if (selection == null) {
            return Collections.emptyList();
        }

        char toned = tone.apply(selection.vowel);
        if (toned == ToneMark.NO_MAPPING) {
            // "gi" followed by a consonant selects a letter with no toned form
            log.debug("No {} form for '{}' at {}", tone, selection.vowel, selection.index);
            return Collections.emptyList();
        }
        return synthesizer.rewrite(buffer, selection.index, toned, true);
    }
}
