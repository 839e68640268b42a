package villagecompute.community.data.models;

public enum BadgeRarity {
    COMMON, UNCOMMON, RARE, EPIC, LEGENDARY
}
