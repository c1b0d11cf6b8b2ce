package com.arrowcontrol.controller.dto;

public record CleanupResult(int removed, int remaining) {
}
