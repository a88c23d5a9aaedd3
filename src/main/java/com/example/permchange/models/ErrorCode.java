package com.example.permchange.models;

import java.util.Arrays;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Error kinds the authority may report in a status code. The table is versioned with this
 * client; codes it does not list resolve to {@link #UNKNOWN} and the raw value is kept by
 * {@link ServerError}.
 */
public enum ErrorCode {
    UNKNOWN(-1),

    // connection level
    CONNECTION_CLOSED(100),
    OTHER_ERROR(101),
    UNKNOWN_MESSAGE(102),
    BAD_SYNTAX(103),
    LIMITS_EXCEEDED(104),
    WRONG_PROTOCOL_VERSION(105),
    BAD_SESSION_IDENT(106),
    REUSE_OF_SESSION_IDENT(107),
    BOUND_IN_OTHER_SESSION(108),
    BAD_MESSAGE_ORDER(109),

    // session level
    SESSION_CLOSED(200),
    OTHER_SESSION_ERROR(201),
    TOKEN_EXPIRED(202),
    BAD_AUTHENTICATION(203),
    ILLEGAL_REALM_PATH(204),
    NO_SUCH_REALM(205),
    PERMISSION_DENIED(206),
    BAD_SERVER_FILE_IDENT(207),
    BAD_CLIENT_FILE_IDENT(208),
    BAD_SERVER_VERSION(209),
    BAD_CLIENT_VERSION(210),
    DIVERGING_HISTORIES(211),
    BAD_CHANGESET(212),

    // request level
    INVALID_PARAMETERS(601),
    MISSING_PARAMETERS(602),
    INVALID_CREDENTIALS(611),
    UNKNOWN_ACCOUNT(612),
    EXISTING_ACCOUNT(613),
    ACCESS_DENIED(614),
    EXPIRED_REFRESH_TOKEN(615),
    INVALID_HOST(616),
    REALM_NOT_FOUND(617),
    UNKNOWN_USER(618),

    // sharing
    EXPIRED_PERMISSION_OFFER(701),
    AMBIGUOUS_PERMISSION_OFFER_TOKEN(702),
    FILE_MAY_NOT_BE_SHARED(703),

    SERVER_MISCONFIGURATION(801);

    private static final Map<Integer, ErrorCode> BY_CODE = Arrays.stream(values())
            .filter(ErrorCode::isKnown)
            .collect(Collectors.toUnmodifiableMap(ErrorCode::code, Function.identity()));

    private final int code;

    ErrorCode(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    public boolean isKnown() {
        return this != UNKNOWN;
    }

    public static ErrorCode fromCode(int code) {
        return BY_CODE.getOrDefault(code, UNKNOWN);
    }
}
