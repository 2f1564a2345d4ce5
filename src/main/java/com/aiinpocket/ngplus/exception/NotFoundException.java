package com.aiinpocket.ngplus.exception;

/**
 * 找不到指定 id 的任務、技能、獎勵、膠囊、日誌、目標或模板。
 */
public class NotFoundException extends RuntimeException {

    public NotFoundException(String message) {
        super(message);
    }

    public static NotFoundException skill(String id) {
        return new NotFoundException("Skill not found: " + id);
    }

    public static NotFoundException reward(String id) {
        return new NotFoundException("Reward not found: " + id);
    }

    public static NotFoundException capsule(String id) {
        return new NotFoundException("Capsule not found: " + id);
    }

    public static NotFoundException journalEntry(String id) {
        return new NotFoundException("Journal entry not found: " + id);
    }

    public static NotFoundException goal(String id) {
        return new NotFoundException("Goal not found: " + id);
    }

    public static NotFoundException template(String id) {
        return new NotFoundException("Template not found: " + id);
    }
}
