package com.magicminds.backend.modules.room.domain;

import java.security.SecureRandom;
import java.util.List;
import java.util.Random;

import org.springframework.stereotype.Component;

/**
 * Fixed set of AI companions that fill a room created without invited friends.
 */
@Component
public class AiPlayerRoster {

    public record AiPlayer(String name, String avatar) {
    }

    public static final List<AiPlayer> PLAYERS = List.of(
            new AiPlayer("Alex the Explorer", "🧭"),
            new AiPlayer("Bella the Builder", "🏗️"),
            new AiPlayer("Charlie the Chef", "👨‍🍳"),
            new AiPlayer("Diana the Detective", "🕵️")
    );

    private final Random random;

    public AiPlayerRoster() {
        this(new SecureRandom());
    }

    AiPlayerRoster(Random random) {
        this.random = random;
    }

    public AiPlayer pick() {
        return PLAYERS.get(random.nextInt(PLAYERS.size()));
    }
}
