package com.reelindex.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class EdlWriterTest {

    @Test
    void formatsSmpteTimecode() {
        assertThat(EdlWriter.toSmpte(0.0, 25.0)).isEqualTo("00:00:00:00");
        assertThat(EdlWriter.toSmpte(61.4, 25.0)).isEqualTo("00:01:01:10");
        assertThat(EdlWriter.toSmpte(3600.0, 24.0)).isEqualTo("01:00:00:00");
    }

    @Test
    void recordSideIsContiguous() {
        String edl = new EdlWriter("Selects")
                .addEvent("a.mov", 10.0, 12.0, 25.0)
                .addEvent("b.mov", 0.0, 1.0, 25.0)
                .build();

        assertThat(edl).startsWith("TITLE: Selects\nFCM: NON-DROP FRAME\n\n");
        assertThat(edl).contains("001  AX       V     C        00:00:10:00 00:00:12:00 00:00:00:00 00:00:02:00");
        assertThat(edl).contains("002  AX       V     C        00:00:00:00 00:00:01:00 00:00:02:00 00:00:03:00");
        assertThat(edl).contains("* FROM CLIP NAME: a.mov");
        assertThat(edl).contains("* FROM CLIP NAME: b.mov");
    }

    @Test
    void missingFrameRateFallsBackToDefault() {
        EdlWriter writer = new EdlWriter("T").addEvent("c.mp4", 0.0, 1.0, null);

        assertThat(writer.getEventCount()).isEqualTo(1);
        // 1s at 29.97 rounds to 30 frames, a full nominal second
        assertThat(writer.build()).contains("00:00:00:00 00:00:01:00");
    }
}
