package de.bycsitsm.agenda.grid;

import de.bycsitsm.agenda.AgendaProperties;
import org.springframework.stereotype.Component;

/**
 * Labels a placement with the event title and links it to the occasion, using the configured
 * link pattern with its {@code {event}} and {@code {occasion}} placeholders.
 */
@Component
class DefaultPlacementFormatter implements PlacementFormatter {

    private final String linkPattern;

    DefaultPlacementFormatter(AgendaProperties agendaProperties) {
        this.linkPattern = agendaProperties.occasionLinkPattern();
    }

    @Override
    public PresentationUnit format(Placement placement) {
        var occasion = placement.occasion();
        var link = linkPattern
                .replace("{event}", occasion.event().id().toString())
                .replace("{occasion}", occasion.id().toString());
        return new PresentationUnit(occasion.title(), link, placement.visualClass());
    }
}
