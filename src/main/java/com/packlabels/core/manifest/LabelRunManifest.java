package com.packlabels.core.manifest;

import com.packlabels.core.document.LabelDocument;
import com.packlabels.core.label.PackSplit;
import com.packlabels.core.order.AggregatedOrder;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * JSON record of what went onto a label sheet, written next to the PDF.
 */
public final class LabelRunManifest {

    public static final String DEFAULT_FILENAME = "labels-manifest.json";

    private final String generatedAt;
    private final String source;
    private final List<OrderLine> orders;
    private final PackSplit packTotals;
    private final int labelPages;
    private final int summaryPages;

    private LabelRunManifest(String generatedAt,
                             String source,
                             List<OrderLine> orders,
                             PackSplit packTotals,
                             int labelPages,
                             int summaryPages) {
        this.generatedAt = generatedAt;
        this.source = source;
        this.orders = List.copyOf(orders);
        this.packTotals = packTotals;
        this.labelPages = labelPages;
        this.summaryPages = summaryPages;
    }

    public static LabelRunManifest from(LabelDocument document, String source) {
        List<OrderLine> lines = new ArrayList<>();
        for (AggregatedOrder order : document.orders()) {
            lines.add(new OrderLine(order.name(), order.carryOut(), order.dineIn(), PackSplit.requiredLabels(order.carryOut())));
        }
        return new LabelRunManifest(
            Instant.now().toString(),
            source == null ? "" : source,
            lines,
            document.labels().totals(),
            document.labelPages().size(),
            document.summaryPages().size()
        );
    }

    public String generatedAt() {
        return generatedAt;
    }

    public String source() {
        return source;
    }

    public List<OrderLine> orders() {
        return orders;
    }

    public PackSplit packTotals() {
        return packTotals;
    }

    public int labelPages() {
        return labelPages;
    }

    public int summaryPages() {
        return summaryPages;
    }

    public void writeTo(Path target) throws IOException {
        JSONObject root = new JSONObject();
        root.put("generatedAt", generatedAt);
        root.put("source", source);

        JSONArray ordersArray = new JSONArray();
        for (OrderLine line : orders) {
            JSONObject orderObj = new JSONObject();
            orderObj.put("name", line.name());
            orderObj.put("carryOut", line.carryOut());
            orderObj.put("dineIn", line.dineIn());
            orderObj.put("labels", line.labels());
            ordersArray.put(orderObj);
        }
        root.put("orders", ordersArray);

        JSONObject packObj = new JSONObject();
        packObj.put("doubles", packTotals.doubles());
        packObj.put("singles", packTotals.singles());
        root.put("packSummary", packObj);

        JSONObject pagesObj = new JSONObject();
        pagesObj.put("labels", labelPages);
        pagesObj.put("summary", summaryPages);
        root.put("pages", pagesObj);

        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(
            target,
            root.toString(2),
            StandardOpenOption.CREATE,
            StandardOpenOption.TRUNCATE_EXISTING,
            StandardOpenOption.WRITE
        );
    }

    public static LabelRunManifest load(Path path) throws IOException {
        try {
            JSONObject root = new JSONObject(Files.readString(path));
            List<OrderLine> lines = new ArrayList<>();
            JSONArray ordersArray = root.optJSONArray("orders");
            if (ordersArray != null) {
                for (int i = 0; i < ordersArray.length(); i++) {
                    JSONObject orderObj = ordersArray.optJSONObject(i);
                    if (orderObj == null) {
                        continue;
                    }
                    lines.add(new OrderLine(
                        orderObj.optString("name", ""),
                        Math.max(orderObj.optInt("carryOut", 0), 0),
                        Math.max(orderObj.optInt("dineIn", 0), 0),
                        Math.max(orderObj.optInt("labels", 0), 0)
                    ));
                }
            }
            JSONObject packObj = root.optJSONObject("packSummary");
            PackSplit totals = packObj == null
                ? PackSplit.NONE
                : new PackSplit(packObj.optInt("doubles", 0), packObj.optInt("singles", 0));
            JSONObject pagesObj = root.optJSONObject("pages");
            return new LabelRunManifest(
                root.optString("generatedAt", ""),
                root.optString("source", ""),
                lines,
                totals,
                pagesObj == null ? 0 : pagesObj.optInt("labels", 0),
                pagesObj == null ? 0 : pagesObj.optInt("summary", 0)
            );
        } catch (JSONException ex) {
            throw new IOException("Failed to parse manifest " + path + ": " + ex.getMessage(), ex);
        }
    }

    public record OrderLine(String name, int carryOut, int dineIn, int labels) {
    }
}
