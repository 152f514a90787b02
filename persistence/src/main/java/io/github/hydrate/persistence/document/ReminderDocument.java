package io.github.hydrate.persistence.document;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

@JsonIgnoreProperties(ignoreUnknown = true)
public class ReminderDocument {

    private String id;
    private String time;
    private int timezoneOffsetMinutes;
    private int repeatEveryMinutes;
    private String repeatUntil;
    @JsonProperty("lastSentISO")
    private Instant lastSentISO;

    public ReminderDocument() {}

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public String getTime() { return time; }
    public void setTime(String time) { this.time = time; }

    public int getTimezoneOffsetMinutes() { return timezoneOffsetMinutes; }
    public void setTimezoneOffsetMinutes(int timezoneOffsetMinutes) { this.timezoneOffsetMinutes = timezoneOffsetMinutes; }

    public int getRepeatEveryMinutes() { return repeatEveryMinutes; }
    public void setRepeatEveryMinutes(int repeatEveryMinutes) { this.repeatEveryMinutes = repeatEveryMinutes; }

    public String getRepeatUntil() { return repeatUntil; }
    public void setRepeatUntil(String repeatUntil) { this.repeatUntil = repeatUntil; }

    @JsonProperty("lastSentISO")
    public Instant getLastSentISO() { return lastSentISO; }
    @JsonProperty("lastSentISO")
    public void setLastSentISO(Instant lastSentISO) { this.lastSentISO = lastSentISO; }

    public ReminderDocument copy() {
        ReminderDocument c = new ReminderDocument();
        c.id = id;
        c.time = time;
        c.timezoneOffsetMinutes = timezoneOffsetMinutes;
        c.repeatEveryMinutes = repeatEveryMinutes;
        c.repeatUntil = repeatUntil;
        c.lastSentISO = lastSentISO;
        return c;
    }
}
