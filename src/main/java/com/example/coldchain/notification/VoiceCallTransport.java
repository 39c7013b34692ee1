package com.example.coldchain.notification;

import java.io.IOException;
import java.util.List;

/**
 * Outbound text-to-speech calls.
 */
public interface VoiceCallTransport {

    /** False when provider URL, key or caller number is missing. */
    boolean isConfigured();

    void placeCall(String message, List<String> phoneNumbers) throws IOException;
}
