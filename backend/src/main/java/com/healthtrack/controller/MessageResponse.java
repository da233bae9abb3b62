package com.healthtrack.controller;

/** Body for operations that only report an outcome. */
public record MessageResponse(String message) {
}
