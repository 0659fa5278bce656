package com.keacast.assistant.mapper;

import com.keacast.assistant.mapper.model.TransactionRecord;
import com.keacast.assistant.mapper.model.TransactionSummary;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.time.LocalDate;
import java.util.List;

@Mapper
public interface TransactionMapper {

    // 账户交易（带分类 logo），按日期倒序
    List<TransactionRecord> findByAccount(@Param("userId") String userId,
                                          @Param("accountId") String accountId,
                                          @Param("start") LocalDate start,
                                          @Param("end") LocalDate end,
                                          @Param("limit") int limit,
                                          @Param("offset") int offset);

    long countByAccount(@Param("accountId") String accountId,
                        @Param("start") LocalDate start,
                        @Param("end") LocalDate end);

    TransactionSummary summarize(@Param("accountId") String accountId,
                                 @Param("start") LocalDate start,
                                 @Param("end") LocalDate end);

    // forecast_type IN ('RF','F')
    List<TransactionRecord> findRecurringForecasts(@Param("accountId") String accountId,
                                                   @Param("limit") int limit,
                                                   @Param("offset") int offset);

    long countRecurringForecasts(@Param("accountId") String accountId);

    List<TransactionRecord> findUpcoming(@Param("accountId") String accountId,
                                         @Param("forecastType") String forecastType,
                                         @Param("start") LocalDate start,
                                         @Param("end") LocalDate end,
                                         @Param("limit") int limit,
                                         @Param("offset") int offset);

    long countUpcoming(@Param("accountId") String accountId,
                       @Param("forecastType") String forecastType,
                       @Param("start") LocalDate start,
                       @Param("end") LocalDate end);
}
