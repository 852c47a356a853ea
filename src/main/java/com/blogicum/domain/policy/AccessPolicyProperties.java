package com.blogicum.domain.policy;

import com.blogicum.domain.enums.DenialMode;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 访问策略，启动时解析一次。
 *
 * @param staffOverride staff 是否可以编辑/删除别人的帖子和评论
 * @param staffSeesAll  staff 是否能看到所有帖子（包括未发布/定时发布的）
 * @param denialMode    非作者写操作被拒绝时的响应方式
 */
@ConfigurationProperties(prefix = "blog.access")
public record AccessPolicyProperties(
        boolean staffOverride,
        boolean staffSeesAll,
        DenialMode denialMode
) {

    public AccessPolicyProperties {
        if (denialMode == null) {
            denialMode = DenialMode.FORBIDDEN;
        }
    }

    public static AccessPolicyProperties defaults() {
        return new AccessPolicyProperties(false, false, DenialMode.FORBIDDEN);
    }
}
