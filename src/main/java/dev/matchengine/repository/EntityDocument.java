package dev.matchengine.repository;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import dev.matchengine.model.Entity;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Layout of the entity data file: {"candidates": [...], "jobs": [...]}.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class EntityDocument {
    private List<Entity> candidates = new ArrayList<>();
    private List<Entity> jobs = new ArrayList<>();
}
