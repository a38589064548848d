package org.dvsim.routing.overlay;

import lombok.Getter;
import lombok.ToString;
import lombok.experimental.Accessors;
import org.dvsim.routing.graph.LinkCost;

import java.util.Objects;

/**
 * One queued topology edit in label space.
 * <p>
 * Cost domain:
 * </p>
 * <ul>
 * <li>{@code -1}: remove the link (no-op when absent)</li>
 * <li>{@code > 0}: add the link or overwrite its cost</li>
 * </ul>
 */
@Getter
@ToString
@Accessors(fluent = true)
public final class LinkUpdate {

    private final String source;
    private final String destination;
    private final int cost;

    private LinkUpdate(String source, String destination, int cost) {
        this.source = Objects.requireNonNull(source, "source");
        this.destination = Objects.requireNonNull(destination, "destination");
        if (source.equals(destination)) {
            throw new IllegalArgumentException("self link not allowed: " + source);
        }
        this.cost = LinkCost.requireLinkCost(cost);
    }

    /**
     * Creates an add-or-overwrite edit, or a removal when {@code cost == -1}.
     */
    public static LinkUpdate of(String source, String destination, int cost) {
        return new LinkUpdate(source, destination, cost);
    }

    public static LinkUpdate remove(String source, String destination) {
        return new LinkUpdate(source, destination, LinkCost.DELETE);
    }

    public boolean isRemoval() {
        return cost == LinkCost.DELETE;
    }
}
