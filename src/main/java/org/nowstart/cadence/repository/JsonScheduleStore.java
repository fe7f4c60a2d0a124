package org.nowstart.cadence.repository;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.nowstart.cadence.data.dto.ScheduledBuy;
import org.nowstart.cadence.data.property.ScheduleProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

@Repository
public class JsonScheduleStore extends JsonFileStore<List<ScheduledBuy>> implements ScheduleStore {

    @Autowired
    public JsonScheduleStore(ObjectMapper objectMapper, ScheduleProperties scheduleProperties) {
        this(objectMapper, Path.of(scheduleProperties.path()));
    }

    JsonScheduleStore(ObjectMapper objectMapper, Path path) {
        super(objectMapper, path, new TypeReference<>() {}, ArrayList::new);
    }

    @Override
    public List<ScheduledBuy> load() {
        return read();
    }

    @Override
    public void save(List<ScheduledBuy> entries) {
        write(List.copyOf(entries));
    }
}
