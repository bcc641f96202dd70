package org.physlang.engine.physics;

/**
 * Pairwise force between particles identified by their index in the world.
 */
public sealed interface Force permits Force.Gravity, Force.Spring {

    int first();

    int second();

    /**
     * Newtonian attraction: each particle accelerates toward the other by G * m_other / r^2.
     */
    record Gravity(int first, int second, double g) implements Force {
    }

    /**
     * Hookean spring: k * (r - rest) / m_self along the separation, toward the
     * other particle when stretched and away from it when compressed.
     */
    record Spring(int first, int second, double k, double rest) implements Force {
    }
}
