package com.draftflow.domain.gateway;

import java.util.List;

/**
 * PersonDirectoryGateway - 人员名录网关
 *
 * @author draftflow
 */
public interface PersonDirectoryGateway {

    List<String> findDesignerNames();

    List<String> findEngineerNames();
}
