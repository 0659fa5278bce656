package com.keacast.assistant.mapper;

import com.keacast.assistant.mapper.model.AccountRecord;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;

@Mapper
public interface AccountMapper {

    List<AccountRecord> findByUser(@Param("userId") String userId,
                                   @Param("limit") int limit,
                                   @Param("offset") int offset);

    long countByUser(@Param("userId") String userId);
}
