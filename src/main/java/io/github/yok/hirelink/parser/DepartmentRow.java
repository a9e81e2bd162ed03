package io.github.yok.hirelink.parser;

import lombok.Value;

/**
 * Department entry of a batch-insert request, exactly as sent by the client.
 *
 * @author Yasuharu.Okawauchi
 */
@Value
public class DepartmentRow {

    // Integer id, or null when missing or not an integer
    Integer id;
    // Name, or null when missing or not a string
    String name;
}
