package com.restaurantbi.insightflow.infrastructure.persistence.run;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.restaurantbi.insightflow.domain.repository.WorkflowRunRepository;
import com.restaurantbi.insightflow.domain.run.RunState;
import com.restaurantbi.insightflow.domain.run.TaskInstance;
import com.restaurantbi.insightflow.domain.run.WorkflowRun;
import com.restaurantbi.insightflow.infrastructure.persistence.run.converter.WorkflowRunConverter;
import com.restaurantbi.insightflow.infrastructure.persistence.run.entity.TaskInstanceDO;
import com.restaurantbi.insightflow.infrastructure.persistence.run.entity.WorkflowRunDO;
import com.restaurantbi.insightflow.infrastructure.persistence.run.mapper.TaskInstanceMapper;
import com.restaurantbi.insightflow.infrastructure.persistence.run.mapper.WorkflowRunMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * WorkflowRunRepositoryImpl - 运行仓储实现
 * <p>
 * 运行与任务实例分表存储，保存时按 runId + taskId 逐条插入或更新。
 * </p>
 * 
 * @author insightflow
 */
@Repository
public class WorkflowRunRepositoryImpl implements WorkflowRunRepository {
    
    private static final List<String> TERMINAL_STATES = Arrays.stream(RunState.values())
        .filter(RunState::isTerminal)
        .map(Enum::name)
        .collect(Collectors.toList());
    
    private final WorkflowRunMapper workflowRunMapper;
    private final TaskInstanceMapper taskInstanceMapper;
    
    public WorkflowRunRepositoryImpl(WorkflowRunMapper workflowRunMapper,
                                     TaskInstanceMapper taskInstanceMapper) {
        this.workflowRunMapper = workflowRunMapper;
        this.taskInstanceMapper = taskInstanceMapper;
    }
    
    @Override
    @Transactional
    public void save(WorkflowRun run) {
        WorkflowRunDO runDO = workflowRunMapper.selectById(run.getRunId());
        if (runDO == null) {
            workflowRunMapper.insert(WorkflowRunConverter.toDataObject(run));
        } else {
            WorkflowRunConverter.copyRunFields(run, runDO);
            workflowRunMapper.updateById(runDO);
        }
        
        Map<String, TaskInstanceDO> existing = selectTasks(run.getRunId()).stream()
            .collect(Collectors.toMap(TaskInstanceDO::getTaskId, Function.identity()));
        
        int position = 0;
        for (TaskInstance instance : run.taskInstances()) {
            TaskInstanceDO taskDO = existing.get(instance.getTaskId());
            if (taskDO == null) {
                taskInstanceMapper.insert(
                    WorkflowRunConverter.taskToDataObject(instance, run.getRunId(), position));
            } else {
                WorkflowRunConverter.copyTaskFields(instance, taskDO);
                taskDO.setSortOrder(position);
                taskInstanceMapper.updateById(taskDO);
            }
            position++;
        }
    }
    
    @Override
    public Optional<WorkflowRun> findById(String runId) {
        WorkflowRunDO runDO = workflowRunMapper.selectById(runId);
        if (runDO == null) {
            return Optional.empty();
        }
        return Optional.of(WorkflowRunConverter.toDomain(runDO, selectTasks(runId)));
    }
    
    @Override
    public List<WorkflowRun> findByPipelineAndLogicalKey(String pipelineId, String logicalKey) {
        List<WorkflowRunDO> runDOs = workflowRunMapper.selectList(
            new LambdaQueryWrapper<WorkflowRunDO>()
                .eq(WorkflowRunDO::getPipelineId, pipelineId)
                .eq(WorkflowRunDO::getLogicalKey, logicalKey)
                .orderByAsc(WorkflowRunDO::getCreatedAt)
        );
        return toDomains(runDOs);
    }
    
    @Override
    public List<WorkflowRun> findTerminalBefore(Instant before) {
        List<WorkflowRunDO> runDOs = workflowRunMapper.selectList(
            new LambdaQueryWrapper<WorkflowRunDO>()
                .in(WorkflowRunDO::getState, TERMINAL_STATES)
                .lt(WorkflowRunDO::getFinishedAt, before)
                .orderByAsc(WorkflowRunDO::getFinishedAt)
        );
        return toDomains(runDOs);
    }
    
    @Override
    @Transactional
    public void delete(String runId) {
        taskInstanceMapper.delete(
            new LambdaQueryWrapper<TaskInstanceDO>().eq(TaskInstanceDO::getRunId, runId));
        workflowRunMapper.deleteById(runId);
    }
    
    private List<TaskInstanceDO> selectTasks(String runId) {
        return taskInstanceMapper.selectList(
            new LambdaQueryWrapper<TaskInstanceDO>()
                .eq(TaskInstanceDO::getRunId, runId)
                .orderByAsc(TaskInstanceDO::getSortOrder)
        );
    }
    
    private List<WorkflowRun> toDomains(List<WorkflowRunDO> runDOs) {
        return runDOs.stream()
            .map(runDO -> WorkflowRunConverter.toDomain(runDO, selectTasks(runDO.getRunId())))
            .collect(Collectors.toList());
    }
}
