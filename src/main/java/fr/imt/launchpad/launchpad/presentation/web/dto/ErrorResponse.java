package fr.imt.launchpad.launchpad.presentation.web.dto;

public record ErrorResponse(String errorCode, String message) {
}
