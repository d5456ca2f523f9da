import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

public class ExpensePolicyCheck {

    private static final double VP_THRESHOLD = 500.0;

    public static Map<String, Object> verify(double amount, String category, List<String> approvals)
            throws IOException {
        List<String> violations = new ArrayList<>();
        List<String> actions = new ArrayList<>();

        if (amount > VP_THRESHOLD && !approvals.contains("VP_APPROVAL")) {
            violations.add(String.format(Locale.ROOT, "Expense amount $%.2f exceeds $500 threshold", amount));
            actions.add("Obtain VP_APPROVAL for expenses over $500");
        }

        Double limit = categoryLimits().get(category.toLowerCase(Locale.ROOT));
        if (limit != null && amount > limit) {
            violations.add(String.format(Locale.ROOT, "%s expenses are limited to $%.2f", category, limit));
            actions.add("Split the expense or request a category exception");
        }

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("compliant", violations.isEmpty());
        result.put("violations", violations);
        result.put("required_actions", actions);
        result.put("amount", amount);
        result.put("category", category);
        return result;
    }

    private static Map<String, Double> categoryLimits() throws IOException {
        Map<String, Double> limits = new HashMap<>();
        InputStream in = ExpensePolicyCheck.class.getResourceAsStream("/category_limits.csv");
        if (in == null) {
            throw new IOException("category_limits.csv not found");
        }
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            reader.readLine();
            String line;
            while ((line = reader.readLine()) != null) {
                String[] cols = line.split(",");
                if (cols.length == 2) {
                    limits.put(cols[0].trim().toLowerCase(Locale.ROOT), Double.parseDouble(cols[1].trim()));
                }
            }
        }
        return limits;
    }
}
