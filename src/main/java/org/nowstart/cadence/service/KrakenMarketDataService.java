package org.nowstart.cadence.service;

import com.fasterxml.jackson.databind.JsonNode;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.cadence.data.dto.KrakenResponse;
import org.nowstart.cadence.data.type.Timeframe;
import org.nowstart.cadence.port.CollaboratorResult;
import org.nowstart.cadence.port.PriceQuoteProvider;
import org.nowstart.cadence.port.PriceSeriesProvider;
import org.nowstart.cadence.repository.KrakenFeignClient;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class KrakenMarketDataService implements PriceSeriesProvider, PriceQuoteProvider {

    private static final int OHLC_CLOSE_INDEX = 4;

    private final KrakenFeignClient krakenFeignClient;

    @Override
    public CollaboratorResult<double[]> closingPrices(String symbol, Timeframe timeframe, int count) {
        KrakenResponse<JsonNode> response;
        try {
            response = krakenFeignClient.getOhlc(symbol, timeframe.getIntervalMinutes());
        } catch (Exception e) {
            log.warn("OHLC fetch failed. symbol={}, timeframe={}", symbol, timeframe, e);
            return CollaboratorResult.failure("OHLC fetch failed: " + e.getMessage());
        }
        if (response == null || response.hasError() || response.result() == null) {
            String reason = response == null ? "empty response" : response.errorMessage();
            return CollaboratorResult.failure("OHLC error: " + (reason.isBlank() ? "no result" : reason));
        }

        JsonNode rows = firstPairNode(response.result());
        if (rows == null || !rows.isArray() || rows.isEmpty()) {
            return CollaboratorResult.failure("OHLC returned no candles for " + symbol);
        }

        List<Double> closes = new ArrayList<>();
        for (JsonNode row : rows) {
            JsonNode close = row.get(OHLC_CLOSE_INDEX);
            if (close == null) {
                continue;
            }
            try {
                closes.add(new BigDecimal(close.asText()).doubleValue());
            } catch (NumberFormatException e) {
                log.warn("Skipping unparseable OHLC row. symbol={}, row={}", symbol, row);
            }
        }
        int from = Math.max(0, closes.size() - count);
        double[] series = closes.subList(from, closes.size()).stream().mapToDouble(Double::doubleValue).toArray();
        return CollaboratorResult.success(series);
    }

    @Override
    public CollaboratorResult<BigDecimal> currentPrice(String symbol) {
        KrakenResponse<JsonNode> response;
        try {
            response = krakenFeignClient.getTicker(symbol);
        } catch (Exception e) {
            log.warn("Ticker fetch failed. symbol={}", symbol, e);
            return CollaboratorResult.failure("ticker fetch failed: " + e.getMessage());
        }
        if (response == null || response.hasError() || response.result() == null) {
            String reason = response == null ? "empty response" : response.errorMessage();
            return CollaboratorResult.failure("ticker error: " + (reason.isBlank() ? "no result" : reason));
        }

        JsonNode ticker = firstPairNode(response.result());
        JsonNode last = ticker == null ? null : ticker.path("c").get(0);
        if (last == null) {
            return CollaboratorResult.failure("ticker has no last trade price for " + symbol);
        }
        try {
            BigDecimal price = new BigDecimal(last.asText());
            if (price.signum() <= 0) {
                return CollaboratorResult.failure("non-positive price for " + symbol);
            }
            return CollaboratorResult.success(price);
        } catch (NumberFormatException e) {
            return CollaboratorResult.failure("unparseable price for " + symbol + ": " + last.asText());
        }
    }

    /**
     * Kraken keys results by its own pair name (e.g. XXBTZUSD), next to a {@code last} cursor.
     */
    private static JsonNode firstPairNode(JsonNode result) {
        Iterator<Map.Entry<String, JsonNode>> fields = result.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (!"last".equals(field.getKey())) {
                return field.getValue();
            }
        }
        return null;
    }
}
