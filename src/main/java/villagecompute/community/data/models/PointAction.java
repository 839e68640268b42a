package villagecompute.community.data.models;

/**
 * Community actions that earn a fixed number of points.
 *
 * <p>
 * The enum name is recorded as the ledger action when points are awarded through
 * {@code PointsService.awardForAction}.
 */
public enum PointAction {

    DAILY_LOGIN(2),
    CREATE_POST(5),
    COMMENT_POST(3),
    COMPLETE_MODULE(10),
    COMPLETE_COURSE(50),
    ATTEND_EVENT(15),
    SHARE_WIN(20),
    COMPLETE_CHALLENGE(25),
    ACCOUNT_REGISTRATION(10),
    RSVP_EVENT(5),
    LIKE_POST(1),
    PROFILE_COMPLETION(15),
    FIRST_POST(10),
    WEEKLY_STREAK(50),
    MONTHLY_STREAK(100),
    DAILY_CHALLENGE_TASK(5),
    BADGE_EARNED(20),
    HELP_ANOTHER_MEMBER(15),
    SHARE_RESOURCE(10),
    ATTEND_BONUS_SESSION(20);

    private final int points;

    PointAction(int points) {
        this.points = points;
    }

    public int points() {
        return points;
    }
}
