package com.ai.salesagent.conversation;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.List;

/**
 * Contact details collected for a viewing booking.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
@JsonIgnoreProperties(ignoreUnknown = true)
public class LeadInfo {

    public static final String MISSING_NAME = "name";
    public static final String MISSING_EMAIL = "email";

    private String firstName;
    private String lastName;
    private String email;
    private String phone;

    public LeadInfo merge(LeadInfo update) {
        if (update == null) return this;
        if (PropertyPreferences.isUsable(update.firstName)) firstName = update.firstName.trim();
        if (PropertyPreferences.isUsable(update.lastName)) lastName = update.lastName.trim();
        if (PropertyPreferences.isUsable(update.email)) email = update.email.trim();
        if (PropertyPreferences.isUsable(update.phone)) phone = update.phone.trim();
        return this;
    }

    /** Name and email are both required before a viewing can be booked. */
    @JsonIgnore
    public boolean isComplete() {
        return StringUtils.isNotBlank(firstName) && StringUtils.isNotBlank(email);
    }

    @JsonIgnore
    public List<String> getMissing() {
        List<String> missing = new ArrayList<>();
        if (StringUtils.isBlank(firstName)) missing.add(MISSING_NAME);
        if (StringUtils.isBlank(email)) missing.add(MISSING_EMAIL);
        return missing;
    }

    @JsonIgnore
    public String getFullName() {
        return StringUtils.trimToEmpty(StringUtils.defaultString(firstName) + " " + StringUtils.defaultString(lastName));
    }

    public LeadInfo copy() {
        return toBuilder().build();
    }
}
