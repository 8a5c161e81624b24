package org.stellora.runtime.messages;

import org.stellora.runtime.model.ResourceKind;

/**
 * The closed set of messages a planet understands.
 * <p>
 * Requests are plain data. They travel inside a {@link PlanetMessage} that carries the
 * reply future, and are answered with a {@link PlanetReply}.
 */
public sealed interface PlanetRequest permits
        PlanetRequest.GenerateResource,
        PlanetRequest.RequestCombine,
        PlanetRequest.RequestRocket,
        PlanetRequest.ExplorerHarvest,
        PlanetRequest.SunrayArrival,
        PlanetRequest.AsteroidArrival,
        PlanetRequest.QueryState {

    /** Where the two inputs of a combination come from. */
    enum InputOrigin {
        /** Both units are taken from the planet's inventory; the product stays on the planet. */
        PLANET,
        /** The requester supplies both units; the product is returned in the reply. */
        REQUESTER
    }

    enum RocketAction { CREATE, USE }

    /**
     * Produce one unit of a base kind into the planet's inventory.
     *
     * @param kind The kind to generate.
     */
    record GenerateResource(ResourceKind kind) implements PlanetRequest {
    }

    /**
     * Combine two units into their recipe product.
     *
     * @param first  First input.
     * @param second Second input.
     * @param origin Who provides the inputs.
     */
    record RequestCombine(ResourceKind first, ResourceKind second, InputOrigin origin) implements PlanetRequest {
    }

    record RequestRocket(RocketAction action) implements PlanetRequest {
    }

    /**
     * Take one unit of {@code kind} from the planet for the requesting explorer.
     *
     * @param kind The kind to take.
     */
    record ExplorerHarvest(ResourceKind kind) implements PlanetRequest {
    }

    /**
     * Charges up to {@code amount} energy cells.
     *
     * @param amount Number of cells to charge.
     */
    record SunrayArrival(int amount) implements PlanetRequest {
    }

    /**
     * Impact on the planet. Deflected by a rocket if one is held.
     *
     * @param damage Number of charged cells destroyed by an unprotected hit.
     */
    record AsteroidArrival(int damage) implements PlanetRequest {
    }

    record QueryState() implements PlanetRequest {
    }
}
