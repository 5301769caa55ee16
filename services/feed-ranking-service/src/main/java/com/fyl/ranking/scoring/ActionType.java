package com.fyl.ranking.scoring;

/**
 * Actions a viewer may take on a post, with the weight each predicted action carries in the
 * final score. Declaration order is the order explanations list them in.
 */
public enum ActionType {
    LIKE("like", 1.0),
    REPOST("repost", 1.2),
    REPLY("reply", 1.0),
    QUOTE("quote", 0.8),
    CLICK("click", 0.6),
    SHARE("share", 0.9),
    FOLLOW_AUTHOR("follow_author", 0.7),
    NOT_INTERESTED("not_interested", -1.5),
    BLOCK_AUTHOR("block_author", -2.0),
    MUTE_AUTHOR("mute_author", -1.8),
    REPORT("report", -2.0);

    private final String key;
    private final double weight;

    ActionType(String key, double weight) {
        this.key = key;
        this.weight = weight;
    }

    public String key() {
        return key;
    }

    public double weight() {
        return weight;
    }
}
