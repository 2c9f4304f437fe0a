package me.golemcore.pipeline.domain.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Competitor {

    private String name;
    private String url;
    private String description;

    @JsonAlias("market_position")
    private String marketPosition;
}
