package com.team.qametrics.model.employee;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.Locale;
import java.util.Optional;

/**
 * 人員識別碼：去除前後空白並轉小寫後的姓名。
 * bug assignee、planning employee_name、員工主檔姓名都先轉成 PersonId 再比對。
 */
@Getter
@EqualsAndHashCode
public final class PersonId {

    private final String key;

    private PersonId(String key) {
        this.key = key;
    }

    /**
     * 空白或 null 的姓名沒有識別碼。
     */
    public static Optional<PersonId> of(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(new PersonId(name.trim().toLowerCase(Locale.ROOT)));
    }

    @Override
    public String toString() {
        return key;
    }
}
