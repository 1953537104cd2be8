package co.fanki.semanticanalyzer.intent.domain.registry;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link KeywordRegistry} lookups.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class KeywordRegistryTest {

    @Test
    void whenListing_givenAbsentName_shouldAnswerFalse() {
        assertFalse(KeywordRegistry.lists(null,
                KeywordRegistry.defaults().filesystemModules()));
    }

    @Test
    void whenListing_givenKnownName_shouldAnswerTrue() {
        assertTrue(KeywordRegistry.lists("save", List.of("save", "insert")));
        assertFalse(KeywordRegistry.lists("Save", List.of("save")));
    }

    @Test
    void whenMatchingFragments_givenMixedCase_shouldIgnoreCase() {
        assertTrue(KeywordRegistry.containsAny("userPassword",
                List.of("password")));
        assertFalse(KeywordRegistry.containsAny(null, List.of("password")));
    }

}
