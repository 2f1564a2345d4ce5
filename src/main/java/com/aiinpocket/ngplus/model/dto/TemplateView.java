package com.aiinpocket.ngplus.model.dto;

import com.aiinpocket.ngplus.model.enums.TemplateCategory;

import java.util.List;

/**
 * 內建與自訂模板共用的檢視。內建模板不統計使用次數，{@code timesUsed} 固定為 0。
 */
public record TemplateView(
        String id,
        String name,
        String description,
        TemplateCategory category,
        boolean builtin,
        List<TemplateRequest.Entry> missions,
        int timesUsed
) {}
