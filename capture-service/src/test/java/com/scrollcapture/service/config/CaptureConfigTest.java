package com.scrollcapture.service.config;

import com.scrollcapture.core.stitch.BlendedOverlapCompositor;
import com.scrollcapture.core.stitch.GapStackCompositor;
import com.scrollcapture.core.stitch.StitchConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import static org.junit.jupiter.api.Assertions.*;

class CaptureConfigTest {

    private CaptureConfig configWithMode(String mode) {
        CaptureConfig config = new CaptureConfig();
        ReflectionTestUtils.setField(config, "stitchMode", mode);
        ReflectionTestUtils.setField(config, "overlapRatio", 0.38);
        ReflectionTestUtils.setField(config, "blendStripPx", 2);
        ReflectionTestUtils.setField(config, "stackGapPx", 4);
        return config;
    }

    @Test
    @DisplayName("capture.stitch.mode selects the compositor")
    void compositorByMode() {
        CaptureConfig blend = configWithMode("blend");
        assertInstanceOf(BlendedOverlapCompositor.class, blend.frameCompositor(blend.stitchConfig()));

        CaptureConfig stack = configWithMode(" Stack ");
        assertInstanceOf(GapStackCompositor.class, stack.frameCompositor(stack.stitchConfig()));
    }

    @Test
    @DisplayName("unknown stitch mode fails fast")
    void unknownMode() {
        CaptureConfig config = configWithMode("mosaic");
        StitchConfig stitchConfig = config.stitchConfig();
        assertThrows(IllegalArgumentException.class, () -> config.frameCompositor(stitchConfig));
    }

    @Test
    @DisplayName("stitch properties flow into StitchConfig")
    void stitchConfig() {
        CaptureConfig config = configWithMode("blend");
        ReflectionTestUtils.setField(config, "overlapRatio", 0.25);

        StitchConfig stitchConfig = config.stitchConfig();

        assertEquals(0.25, stitchConfig.overlapRatio());
        assertEquals(750, stitchConfig.effectiveHeight(1000), 1e-9);
    }
}
