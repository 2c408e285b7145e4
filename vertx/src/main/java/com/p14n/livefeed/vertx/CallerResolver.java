package com.p14n.livefeed.vertx;

import com.p14n.livefeed.stream.Caller;

import io.vertx.core.MultiMap;

import java.util.Arrays;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Reads the caller identity that the upstream gateway has already
 * authenticated and copied into request headers.
 */
public class CallerResolver {

    public static final String USER_ID = "x-user-id";
    public static final String USER_TYPE = "x-user-type";
    public static final String RESTAURANT_ID = "x-restaurant-id";
    public static final String PERMISSIONS = "x-user-permissions";

    /**
     * @return the caller, or empty when no user id was supplied
     */
    public Optional<Caller> resolve(MultiMap headers) {
        String userId = trimToNull(headers.get(USER_ID));
        if (userId == null) {
            return Optional.empty();
        }
        return Optional.of(new Caller(userId,
                trimToNull(headers.get(RESTAURANT_ID)),
                trimToNull(headers.get(USER_TYPE)),
                permissions(headers.get(PERMISSIONS))));
    }

    static Set<String> permissions(String header) {
        if (header == null) {
            return Set.of();
        }
        return Arrays.stream(header.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toSet());
    }

    private static String trimToNull(String s) {
        if (s == null || s.isBlank()) {
            return null;
        }
        return s.trim();
    }
}
