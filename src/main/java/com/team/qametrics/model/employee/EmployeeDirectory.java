package com.team.qametrics.model.employee;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 以 PersonId 為 key 的唯讀員工目錄。
 * 每次重新載入都建立新的實例；同名員工以第一筆為準。
 */
public final class EmployeeDirectory {

    private static final EmployeeDirectory EMPTY = new EmployeeDirectory(Map.of());

    private final Map<PersonId, Employee> employees;

    private EmployeeDirectory(Map<PersonId, Employee> employees) {
        this.employees = employees;
    }

    public static EmployeeDirectory of(List<Employee> employees) {
        if (employees == null || employees.isEmpty()) {
            return EMPTY;
        }
        Map<PersonId, Employee> byId = new LinkedHashMap<>();
        for (Employee employee : employees) {
            if (employee == null) continue;
            PersonId.of(employee.getName())
                    .ifPresent(id -> byId.putIfAbsent(id, employee));
        }
        return new EmployeeDirectory(Collections.unmodifiableMap(byId));
    }

    public static EmployeeDirectory empty() {
        return EMPTY;
    }

    public Optional<Employee> find(String name) {
        return PersonId.of(name).flatMap(this::find);
    }

    public Optional<Employee> find(PersonId id) {
        return Optional.ofNullable(employees.get(id));
    }

    public boolean contains(String name) {
        return find(name).isPresent();
    }

    public int size() {
        return employees.size();
    }
}
