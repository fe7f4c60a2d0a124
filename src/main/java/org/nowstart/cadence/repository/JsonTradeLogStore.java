package org.nowstart.cadence.repository;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.nowstart.cadence.data.dto.TradeRecord;
import org.nowstart.cadence.data.property.TradingProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

@Repository
public class JsonTradeLogStore extends JsonFileStore<List<TradeRecord>> implements TradeLogStore {

    @Autowired
    public JsonTradeLogStore(ObjectMapper objectMapper, TradingProperties tradingProperties) {
        this(objectMapper, Path.of(tradingProperties.tradeLogPath()));
    }

    JsonTradeLogStore(ObjectMapper objectMapper, Path path) {
        super(objectMapper, path, new TypeReference<>() {}, ArrayList::new);
    }

    @Override
    public List<TradeRecord> load() {
        return read();
    }

    @Override
    public void save(List<TradeRecord> records) {
        write(List.copyOf(records));
    }
}
