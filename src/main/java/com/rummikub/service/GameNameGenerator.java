package com.rummikub.service;

import java.util.List;
import java.util.Random;

/**
 * 生成好记的游戏名称，格式："行动 介词 地点"，例如 "Siege of Gondor"
 */
public class GameNameGenerator {

    static final List<String> ACTIONS = List.of(
        "Siege", "Defense", "Quest", "Trial", "Fall", "Reckoning",
        "Incursion", "Blockade", "Extraction", "Breach", "Containment",
        "Battle", "Challenge", "War", "Conquest", "Showdown", "Rumble",
        "Uprising", "Gambit", "Clash", "Tournament", "Race");

    static final List<String> PREPOSITIONS = List.of("of", "at", "for", "on", "in");

    static final List<String> LOCATIONS = List.of(
        "Gondor", "the Black Forest", "Dragon's Peak", "Ironhold", "the Whispering Caves",
        "Mars", "Sector 7G", "the Orion Nebula", "Titan Station", "Alpha Centauri",
        "Barcelona", "Madrid", "Seville", "Tokyo", "Cairo", "London", "Moscow",
        "Berlin", "Brazil", "Egypt", "Japan", "New York");

    private final Random random;

    public GameNameGenerator(Random random) {
        this.random = random;
    }

    public String generate() {
        return pick(ACTIONS) + " " + pick(PREPOSITIONS) + " " + pick(LOCATIONS);
    }

    private String pick(List<String> words) {
        return words.get(random.nextInt(words.size()));
    }
}
