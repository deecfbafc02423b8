package dev.pekelund.shop.web;

/**
 * JSON body of every API error.
 */
public record ErrorResponse(int status, String error, String message, String path) {
}
