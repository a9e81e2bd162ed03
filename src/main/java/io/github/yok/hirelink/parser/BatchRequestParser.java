package io.github.yok.hirelink.parser;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.yok.hirelink.core.ErrorKind;
import io.github.yok.hirelink.core.WorkforceException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import lombok.extern.slf4j.Slf4j;

/**
 * Reads the JSON batch-insert request document.
 *
 * <pre>
 * {
 *   "departments": [ {"id": 10, "name": "Eng"} ],
 *   "jobs": [ {"id": 20, "name": "SWE"} ],
 *   "hired_employees": [
 *     {"id": 1, "name": "A", "datetime": "2021-02-10T00:00:00Z", "department_id": 10, "job_id": 20}
 *   ]
 * }
 * </pre>
 *
 * <p>
 * {@code departments} and {@code jobs} are optional. {@code hired_employees} must be a non-empty
 * array. Values of the wrong JSON type are passed on as {@code null} so that the validator reports
 * them together with every other violation.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class BatchRequestParser {

    private final ObjectMapper mapper = new ObjectMapper();

    /**
     * Parses a request file.
     *
     * @param file JSON file (UTF-8)
     * @return request
     * @throws WorkforceException {@link ErrorKind#MALFORMED_BATCH} if the document is unreadable
     *         or has the wrong shape
     */
    public BatchRequest parse(Path file) {
        String json;
        try {
            json = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new WorkforceException(ErrorKind.MALFORMED_BATCH,
                    "Cannot read request file: " + file, e);
        }
        return parse(json);
    }

    /**
     * Parses request text.
     *
     * @param json JSON document
     * @return request
     * @throws WorkforceException {@link ErrorKind#MALFORMED_BATCH} if the document is unreadable
     *         or has the wrong shape
     */
    public BatchRequest parse(String json) {
        JsonNode root;
        try {
            root = mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new WorkforceException(ErrorKind.MALFORMED_BATCH,
                    "Request body is not valid JSON.", e);
        }
        if (root == null || !root.isObject()) {
            throw new WorkforceException(ErrorKind.MALFORMED_BATCH,
                    "Request body must be a JSON object.");
        }
        JsonNode employees = root.get("hired_employees");
        if (employees == null || !employees.isArray() || employees.size() == 0) {
            throw new WorkforceException(ErrorKind.MALFORMED_BATCH,
                    "'hired_employees' must be a non-empty list.");
        }

        List<DepartmentRow> departments = readList(root, "departments",
                n -> new DepartmentRow(intOrNull(n.get("id")), textOrNull(n.get("name"))));
        List<JobRow> jobs = readList(root, "jobs",
                n -> new JobRow(intOrNull(n.get("id")), textOrNull(n.get("name"))));
        List<HiredEmployeeRow> hired = readList(root, "hired_employees",
                n -> new HiredEmployeeRow(intOrNull(n.get("id")), textOrNull(n.get("name")),
                        textOrNull(n.get("datetime")), intOrNull(n.get("department_id")),
                        intOrNull(n.get("job_id"))));

        log.debug("Parsed request: departments={}, jobs={}, hired_employees={}",
                departments.size(), jobs.size(), hired.size());
        return new BatchRequest(departments, jobs, hired);
    }

    private static <T> List<T> readList(JsonNode root, String field,
            Function<JsonNode, T> mapper) {
        JsonNode node = root.get(field);
        List<T> rows = new ArrayList<>();
        if (node == null || node.isNull()) {
            return rows;
        }
        if (!node.isArray()) {
            throw new WorkforceException(ErrorKind.MALFORMED_BATCH,
                    "'" + field + "' must be a list.");
        }
        for (JsonNode element : node) {
            if (!element.isObject()) {
                throw new WorkforceException(ErrorKind.MALFORMED_BATCH,
                        "Each entry of '" + field + "' must be an object.");
            }
            rows.add(mapper.apply(element));
        }
        return rows;
    }

    private static Integer intOrNull(JsonNode node) {
        if (node == null || !node.isIntegralNumber() || !node.canConvertToInt()) {
            return null;
        }
        return node.intValue();
    }

    private static String textOrNull(JsonNode node) {
        return (node == null || !node.isTextual()) ? null : node.textValue();
    }
}
