package fr.imt.launchpad.launchpad.business.model;

import java.util.List;

public record RenderedNotification(List<String> recipients, String subject, String body) {
}
