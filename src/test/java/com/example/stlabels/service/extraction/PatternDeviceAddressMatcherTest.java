package com.example.stlabels.service.extraction;

import com.example.stlabels.config.StLabelsConfig;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class PatternDeviceAddressMatcherTest {

    private final PatternDeviceAddressMatcher matcher = new PatternDeviceAddressMatcher(new StLabelsConfig());

    @Test
    void shouldFindDeviceInComment() {
        assertEquals(Optional.of("X0"), matcher.findDevice("START", "X0 Start button"));
        assertEquals(Optional.of("D200"), matcher.findDevice("A", "D200 register"));
    }

    @Test
    void shouldPreferCommentOverName() {
        assertEquals(Optional.of("M100"), matcher.findDevice("Y1_OUT", "M100 relay"));
    }

    @Test
    void shouldFallBackToName() {
        assertEquals(Optional.of("Y10"), matcher.findDevice("Y10_LAMP", "lamp"));
        assertEquals(Optional.of("X3"), matcher.findDevice("X3_IN", null));
    }

    @Test
    void shouldNormalizeCase() {
        assertEquals(Optional.of("X5"), matcher.findDevice("START", "x5 lowercase"));
    }

    @Test
    void shouldNotMatchInsideLongerWords() {
        assertTrue(matcher.findDevice("MAX10", null).isEmpty());
        assertTrue(matcher.findDevice("TEXT12", "no address").isEmpty());
        assertTrue(matcher.findDevice(null, null).isEmpty());
    }

    @Test
    void shouldUseConfiguredPrefixes() {
        // Given
        StLabelsConfig config = new StLabelsConfig();
        config.getLabels().setDevicePrefixes("XY");

        // When
        PatternDeviceAddressMatcher custom = new PatternDeviceAddressMatcher(config);

        // Then
        assertTrue(custom.findDevice("M100", null).isEmpty());
        assertEquals(Optional.of("X1"), custom.findDevice("X1", null));
    }

    @Test
    void shouldDisableMatchingWithoutPrefixes() {
        StLabelsConfig config = new StLabelsConfig();
        config.getLabels().setDevicePrefixes("");

        PatternDeviceAddressMatcher disabled = new PatternDeviceAddressMatcher(config);

        assertTrue(disabled.findDevice("X0", "X0 start").isEmpty());
    }
}
