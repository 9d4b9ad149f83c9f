package com.ai.salesagent.tools;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SearchHit {

    private String title;
    private String snippet;
    private String url;
}
