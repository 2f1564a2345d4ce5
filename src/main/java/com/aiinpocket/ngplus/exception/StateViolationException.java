package com.aiinpocket.ngplus.exception;

/**
 * 指令格式正確，但目前狀態不允許執行，
 * 例如金幣不足仍要兌換，或對未就緒的技能抽選目標。
 */
public class StateViolationException extends IllegalStateException {

    public StateViolationException(String message) {
        super(message);
    }
}
