package com.draftflow.domain.instance;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * ProjectStepTask - 项目步骤下的检查项
 * <p>
 * 与步骤的开始/完成标记一样，checkedTimestamp 只追加：取消勾选不会清除时间。
 * </p>
 *
 * @author draftflow
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProjectStepTask {

    private int orderIndex;

    private String title;

    private boolean checked;

    private LocalDateTime checkedTimestamp;

    /**
     * 来源模板检查项的顺序，手工添加的检查项为 null
     */
    private Integer templateTaskOrderIndex;

    public void toggle(boolean value, LocalDateTime now) {
        this.checked = value;
        if (value && checkedTimestamp == null) {
            this.checkedTimestamp = now;
        }
    }
}
