package org.ecosocial.runtime.worldgen;

import static org.assertj.core.api.Assertions.assertThat;

import org.ecosocial.junit.extensions.logging.LogWatchExtension;
import org.ecosocial.runtime.SimulationSettings;
import org.ecosocial.runtime.internal.services.SeededRandomProvider;
import org.ecosocial.runtime.model.Agent;
import org.ecosocial.runtime.model.Personality;
import org.ecosocial.runtime.model.World;
import org.ecosocial.test.utils.ScriptedRandomProvider;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class WorldGeneratorTest {

    @Test
    void drawsPersonalityAndPositionPerAgentThenFoodThenObstacles() {
        SimulationSettings settings = new SimulationSettings(5, 2, 2, 2);
        ScriptedRandomProvider random = new ScriptedRandomProvider()
                .doubles(0.5, 0.9)
                .ints(1, 2, 3, 4, 0, 0, 0, 0, 4, 4, 4, 4);

        World world = new WorldGenerator(settings).generate(random);

        Agent first = world.getAgent(0);
        Agent second = world.getAgent(1);
        assertThat(first.getPersonality()).isEqualTo(Personality.AGGRESSIVE);
        assertThat(first.getX()).isEqualTo(1);
        assertThat(first.getY()).isEqualTo(2);
        assertThat(second.getPersonality()).isEqualTo(Personality.NEUTRAL);
        assertThat(second.getX()).isEqualTo(3);
        assertThat(second.getY()).isEqualTo(4);
        // Two food units on the same cell are both kept, two obstacles on one cell collapse
        assertThat(world.getResourceCells().toIntArray()).containsExactly(0, 0);
        assertThat(world.getObstacleCells()).containsExactly(world.toFlatIndex(4, 4));
        assertThat(random.getIntCalls()).isEqualTo(12);
        assertThat(random.getDoubleCalls()).isEqualTo(2);
    }

    @Test
    void freshAgentsStartWithDefaults() {
        World world = new WorldGenerator(new SimulationSettings(10, 6, 4, 3)).generate(new SeededRandomProvider(5L));

        assertThat(world.getAgentCount()).isEqualTo(6);
        assertThat(world.getResourceCount()).isEqualTo(4);
        assertThat(world.getObstacleCount()).isBetween(1, 3);
        for (Agent agent : world.getAgents()) {
            assertThat(agent.getHealth()).isEqualTo(100.0);
            assertThat(agent.getScore()).isZero();
            assertThat(agent.isAllied()).isFalse();
            assertThat(world.isInBounds(agent.getX(), agent.getY())).isTrue();
        }
        assertThat(world.getStep()).isZero();
    }
}
