package io.github.yok.hirelink.parser;

import lombok.Value;

/**
 * Hired-employee entry of a batch-insert request, exactly as sent by the client.
 *
 * <p>
 * Fields the client omitted, or sent with the wrong JSON type, are {@code null}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Value
public class HiredEmployeeRow {

    Integer id;
    String name;
    // ISO-8601 text, unparsed
    String datetime;
    Integer departmentId;
    Integer jobId;
}
