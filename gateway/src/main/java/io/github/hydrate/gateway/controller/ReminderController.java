package io.github.hydrate.gateway.controller;

import io.github.hydrate.persistence.document.ReminderDocument;
import io.github.hydrate.protocol.api.AddReminderRequest;
import io.github.hydrate.protocol.api.DeleteReminderRequest;
import io.github.hydrate.protocol.api.ReminderDto;
import io.github.hydrate.protocol.api.RemindersResponse;
import io.github.hydrate.protocol.api.SuccessResponse;
import io.github.hydrate.runtime.reminder.ReminderService;
import org.springframework.web.bind.annotation.*;

import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.stream.Collectors;

@RestController
public class ReminderController {

    /** Same shape as JavaScript's {@code toISOString()}: always three fraction digits. */
    static final DateTimeFormatter LAST_SENT_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS'Z'").withZone(ZoneOffset.UTC);

    private final ReminderService reminderService;

    public ReminderController(ReminderService reminderService) {
        this.reminderService = reminderService;
    }

    @PostMapping("/addReminder")
    public RemindersResponse addReminder(@RequestBody(required = false) AddReminderRequest req) {
        return new RemindersResponse(true, toDtos(reminderService.addReminder(req)));
    }

    @PostMapping("/deleteReminder")
    public SuccessResponse deleteReminder(@RequestBody(required = false) DeleteReminderRequest req) {
        reminderService.deleteReminder(req != null ? req.id() : null);
        return SuccessResponse.ok();
    }

    @GetMapping("/user/{id}/reminders")
    public RemindersResponse userReminders(@PathVariable String id) {
        return new RemindersResponse(true, toDtos(reminderService.getReminders(id)));
    }

    private List<ReminderDto> toDtos(List<ReminderDocument> reminders) {
        return reminders.stream().map(this::toDto).collect(Collectors.toList());
    }

    private ReminderDto toDto(ReminderDocument r) {
        return new ReminderDto(
                r.getId(),
                r.getTime(),
                r.getTimezoneOffsetMinutes(),
                r.getRepeatEveryMinutes(),
                r.getRepeatUntil(),
                r.getLastSentISO() != null ? LAST_SENT_FORMAT.format(r.getLastSentISO()) : null
        );
    }
}
