package rmit.s4134401.clinic;

import java.time.Instant;

public class ActionLog {
    public final Instant when;
    public final String actor;
    public final ActionType type;
    public final String details;

    public ActionLog(Instant when, String actor, ActionType type, String details){
        this.when = when; this.actor = actor; this.type = type; this.details = details;
    }

    @Override public String toString(){ return when + " | " + actor + " | " + type + " | " + details; }
}
