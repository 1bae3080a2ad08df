package com.pulsarr.user;

/**
 * A watchlist owner as far as routing is concerned.
 *
 * @param id               User id
 * @param name             User name
 * @param requiresApproval Every request from this user is held for approval
 */
public record RouterUser(int id, String name, boolean requiresApproval) {
}
