package com.barmm.ledger.mapper;

import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

@Mapper
public interface ProjectMapper {

    @Select("SELECT COUNT(*) FROM projects WHERE project_id = #{projectId}")
    int countById(@Param("projectId") String projectId);
}
