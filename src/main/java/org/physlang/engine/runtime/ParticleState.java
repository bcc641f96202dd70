package org.physlang.engine.runtime;

import org.physlang.engine.physics.Vec2;

import java.util.Objects;

/**
 * Snapshot of a particle for display by a front end.
 */
public record ParticleState(String name, Vec2 position, double mass) {

    public ParticleState {
        Objects.requireNonNull(name, "Name cannot be null");
        Objects.requireNonNull(position, "Position cannot be null");
    }
}
