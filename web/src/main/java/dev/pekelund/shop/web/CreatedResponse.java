package dev.pekelund.shop.web;

public record CreatedResponse(String id) {
}
