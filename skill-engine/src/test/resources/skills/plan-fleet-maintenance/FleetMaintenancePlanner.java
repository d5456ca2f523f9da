import java.util.LinkedHashMap;
import java.util.Map;

public class FleetMaintenancePlanner {

    public static Map<String, Object> plan(Map<String, Object> request) {
        long odometer = ((Number) request.get("odometer_km")).longValue();
        long interval = ((Number) request.get("interval_km")).longValue();
        long next = ((odometer / interval) + 1) * interval;
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("vehicle_id", request.get("vehicle_id"));
        result.put("next_service_km", next);
        result.put("km_remaining", next - odometer);
        result.put("priority", request.get("priority"));
        return result;
    }
}
