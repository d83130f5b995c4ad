package com.draftflow.domain.person;

import com.draftflow.domain.gateway.PersonDirectoryGateway;

import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;
import java.util.stream.Stream;

/**
 * PersonDirectoryService - 移交/接收参与人列表
 * <p>
 * 参与人不落库，每次读取时由设计师、工程师和固定的生产角色合并去重后排序得到。
 * </p>
 *
 * @author draftflow
 */
public class PersonDirectoryService {

    private final PersonDirectoryGateway gateway;
    private final String productionActor;

    public PersonDirectoryService(PersonDirectoryGateway gateway, String productionActor) {
        this.gateway = gateway;
        this.productionActor = productionActor;
    }

    public List<String> listActors() {
        TreeSet<String> names = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
        Stream.concat(gateway.findDesignerNames().stream(), gateway.findEngineerNames().stream())
            .filter(name -> name != null && !name.isBlank())
            .map(String::trim)
            .forEach(names::add);
        if (productionActor != null && !productionActor.isBlank()) {
            names.add(productionActor);
        }
        return new ArrayList<>(names);
    }
}
