package io.spotbot.klines.mapper;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.spotbot.klines.enums.IntervalE;
import io.spotbot.klines.model.KlineModel;
import lombok.experimental.UtilityClass;
import org.jetbrains.annotations.NotNull;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

@UtilityClass
public class KlineMapper {
    private static final ObjectMapper objectMapper = new ObjectMapper();

    @NotNull
    public static List<KlineModel> getKlineModels(String pair, IntervalE interval, String jsonResponse) {
        try {
            JsonNode jsonArray = objectMapper.readTree(jsonResponse);
            List<KlineModel> klines = new ArrayList<>();

            for (JsonNode klineArray : jsonArray) {
                if (klineArray.isArray() && klineArray.size() >= 7) {
                    KlineModel kline = new KlineModel();

                    // [openTime, open, high, low, close, volume, closeTime, ...]
                    kline.setOpenTime(klineArray.get(0).asLong());
                    kline.setOpenPrice(new BigDecimal(klineArray.get(1).asText()));
                    kline.setHighPrice(new BigDecimal(klineArray.get(2).asText()));
                    kline.setLowPrice(new BigDecimal(klineArray.get(3).asText()));
                    kline.setClosePrice(new BigDecimal(klineArray.get(4).asText()));
                    kline.setVolume(new BigDecimal(klineArray.get(5).asText()));
                    kline.setCloseTime(klineArray.get(6).asLong());

                    kline.setPair(pair);
                    kline.setInterval(interval);

                    klines.add(kline);
                }
            }

            return klines;
        } catch (Exception e) {
            throw new IllegalArgumentException("Failed to parse klines from JSON: " + jsonResponse, e);
        }
    }
}

/*
[[1754089680000,"113229.50","113317.00","112500.10","113314.90","3.539",1754089739999,"399615.65490",323,"0.466","52767.31630","0"]]
 */
