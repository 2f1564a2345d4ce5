package com.aiinpocket.ngplus.exception;

/**
 * 指令輸入超出範圍或格式錯誤（難度、體力、技能數量、週期等）。
 */
public class InvalidInputException extends IllegalArgumentException {

    public InvalidInputException(String message) {
        super(message);
    }
}
