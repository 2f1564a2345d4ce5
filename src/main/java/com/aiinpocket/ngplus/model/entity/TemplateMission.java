package com.aiinpocket.ngplus.model.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.*;

/**
 * {@link MissionTemplate} 內的單一任務定義。
 */
@Embeddable
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TemplateMission {

    @Column(nullable = false, length = 200)
    private String title;

    @Column(length = 1000)
    private String note;

    @Column(nullable = false)
    private int difficulty;

    @Column(nullable = false)
    private int energy;
}
