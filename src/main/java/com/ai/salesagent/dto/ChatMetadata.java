package com.ai.salesagent.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Getter
@NoArgsConstructor
@AllArgsConstructor
public class ChatMetadata {

    private String intent;
    private boolean bookingConfirmed;
}
