package com.example.coldchain.notification;

import com.example.coldchain.domain.NotificationFailure;

import java.util.List;

/**
 * Outcome of one send through one channel.
 *
 * @param addresses the addresses the send was (or would have been) made to
 */
public record NotificationResult(boolean ok, NotificationFailure failure, String error, List<String> addresses) {

    public static NotificationResult sent(List<String> addresses) {
        return new NotificationResult(true, null, "", List.copyOf(addresses));
    }

    public static NotificationResult failed(NotificationFailure failure, String error, List<String> addresses) {
        return new NotificationResult(false, failure, error != null ? error : "", List.copyOf(addresses));
    }

    public String joinedAddresses() {
        return String.join(",", addresses);
    }
}
