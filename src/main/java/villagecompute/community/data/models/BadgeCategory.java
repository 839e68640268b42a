package villagecompute.community.data.models;

public enum BadgeCategory {
    ENGAGEMENT, LEARNING, COMMUNITY, ACHIEVEMENT, STREAK, SPECIAL
}
