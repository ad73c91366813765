package de.dreamcube.mazesolver.planning;

import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

public class SearchConfigTest {

    @Test
    public void defaultsAreDeterministicAndQuiet() {
        SearchConfig config = SearchConfig.defaults();
        assertFalse(config.shuffleNeighbors());
        assertFalse(config.verbose());
        assertEquals(SearchConfig.DEFAULT_SEED, config.seed());
    }

    @Test
    public void readsAllKeysFromProperties() {
        Properties properties = new Properties();
        properties.setProperty(SearchConfig.SHUFFLE_KEY, "true");
        properties.setProperty(SearchConfig.SEED_KEY, " 99 ");
        properties.setProperty(SearchConfig.VERBOSE_KEY, "TRUE");

        SearchConfig config = SearchConfig.fromProperties(properties);

        assertTrue(config.shuffleNeighbors());
        assertEquals(99L, config.seed());
        assertTrue(config.verbose());
    }

    @Test
    public void missingKeysFallBackToDefaults() {
        SearchConfig config = SearchConfig.fromProperties(new Properties());
        assertFalse(config.shuffleNeighbors());
        assertEquals(SearchConfig.DEFAULT_SEED, config.seed());
    }

    @Test
    public void malformedSeedIsRejected() {
        Properties properties = new Properties();
        properties.setProperty(SearchConfig.SEED_KEY, "forty-two");
        assertThrows(IllegalArgumentException.class, () -> SearchConfig.fromProperties(properties));
    }

    @Test
    public void withersKeepOtherSettings() {
        SearchConfig config = SearchConfig.defaults().withVerbose(true).withShuffle(5L);
        assertTrue(config.verbose());
        assertTrue(config.shuffleNeighbors());
        assertEquals(5L, config.seed());
    }
}
