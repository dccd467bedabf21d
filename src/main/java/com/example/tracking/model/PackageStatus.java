package com.example.tracking.model;

import com.example.tracking.service.ValidationException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Lifecycle state of a tracked package.
 *
 * pending → in_transit → out_for_delivery → delivered, with exception reachable
 * from any non-terminal state and unknown for codes the carrier reports that we
 * do not recognise.
 */
public enum PackageStatus {

    PENDING("pending", false),
    IN_TRANSIT("in_transit", false),
    OUT_FOR_DELIVERY("out_for_delivery", false),
    DELIVERED("delivered", true),
    EXCEPTION("exception", true),
    UNKNOWN("unknown", false);

    private final String code;
    private final boolean terminal;

    PackageStatus(String code, boolean terminal) {
        this.code = code;
        this.terminal = terminal;
    }

    @JsonValue
    public String code() {
        return code;
    }

    public boolean isTerminal() {
        return terminal;
    }

    /**
     * Status to persist when {@code incoming} is reported for a package currently in this state.
     * A terminal state is only left for another terminal state.
     */
    public PackageStatus mergeWith(PackageStatus incoming) {
        if (incoming == null) {
            return this;
        }
        if (terminal && !incoming.terminal) {
            return this;
        }
        return incoming;
    }

    /**
     * Lenient parse for carrier-supplied codes. Anything unrecognised maps to UNKNOWN.
     */
    @JsonCreator
    public static PackageStatus fromCode(String code) {
        PackageStatus status = lookup(code);
        return status != null ? status : UNKNOWN;
    }

    /**
     * Strict parse for API input such as list filters.
     */
    public static PackageStatus requireCode(String code) {
        PackageStatus status = lookup(code);
        if (status == null) {
            throw new ValidationException("Unrecognised status: " + code);
        }
        return status;
    }

    private static PackageStatus lookup(String code) {
        if (code == null || code.isBlank()) {
            return null;
        }
        String normalized = code.trim().toLowerCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        for (PackageStatus status : values()) {
            if (status.code.equals(normalized)) {
                return status;
            }
        }
        return null;
    }
}
