package com.lunchtable.progression.controller;

/**
 * Authentication happens upstream; the gateway forwards the authenticated player id in this header.
 */
public final class PlayerHeaders {

    public static final String PLAYER_ID = "X-Player-Id";

    private PlayerHeaders() {
    }
}
