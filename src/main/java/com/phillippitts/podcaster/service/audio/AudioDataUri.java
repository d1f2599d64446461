package com.phillippitts.podcaster.service.audio;

import java.util.Base64;

/**
 * Encodes audio bytes as a {@code data:audio/<format>;base64,} URI.
 */
public final class AudioDataUri {

    private AudioDataUri() {
    }

    public static String encode(byte[] audio, String format) {
        byte[] bytes = audio == null ? new byte[0] : audio;
        return "data:audio/" + format + ";base64," + Base64.getEncoder().encodeToString(bytes);
    }
}
