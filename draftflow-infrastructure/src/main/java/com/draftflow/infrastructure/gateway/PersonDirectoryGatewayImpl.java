package com.draftflow.infrastructure.gateway;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.draftflow.domain.gateway.PersonDirectoryGateway;
import com.draftflow.infrastructure.persistence.person.entity.DesignerDO;
import com.draftflow.infrastructure.persistence.person.entity.EngineerDO;
import com.draftflow.infrastructure.persistence.person.mapper.DesignerMapper;
import com.draftflow.infrastructure.persistence.person.mapper.EngineerMapper;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;

/**
 * PersonDirectoryGatewayImpl - 从 designers / engineers 表读取人员名单
 *
 * @author draftflow
 */
@Component
public class PersonDirectoryGatewayImpl implements PersonDirectoryGateway {

    private final DesignerMapper designerMapper;
    private final EngineerMapper engineerMapper;

    public PersonDirectoryGatewayImpl(DesignerMapper designerMapper, EngineerMapper engineerMapper) {
        this.designerMapper = designerMapper;
        this.engineerMapper = engineerMapper;
    }

    @Override
    public List<String> findDesignerNames() {
        return designerMapper.selectList(
                new LambdaQueryWrapper<DesignerDO>().select(DesignerDO::getName)
            ).stream()
            .map(DesignerDO::getName)
            .collect(Collectors.toList());
    }

    @Override
    public List<String> findEngineerNames() {
        return engineerMapper.selectList(
                new LambdaQueryWrapper<EngineerDO>().select(EngineerDO::getName)
            ).stream()
            .map(EngineerDO::getName)
            .collect(Collectors.toList());
    }
}
