package com.aiinpocket.ngplus.service.navigator;

import com.aiinpocket.ngplus.model.enums.PatternKind;

import java.util.Optional;

/**
 * 單一導航模式（策略）。實作為快照的純函數，
 * 以 Spring Bean 註冊，由 {@link NavigatorEngine} 依 {@link PatternKind} 順序執行。
 */
public interface PatternDetector {

    PatternKind getKind();

    Optional<DetectedPattern> detect(NavigatorSnapshot snapshot);
}
