package org.dvsim.routing.core;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.dvsim.routing.overlay.LinkUpdate;

import java.util.List;

/**
 * Complete simulation request in router-label space.
 */
@Value
@Builder
public class SimulationInput {
    /** Declared router labels, any order. */
    @Singular
    List<String> routers;
    /** Initial links; removals here simply mean "no link". */
    @Singular
    List<LinkUpdate> links;
    /** Edits applied after the first convergence, in order. */
    @Singular
    List<LinkUpdate> updates;
}
