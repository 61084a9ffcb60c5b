package com.photo.panogroup.controller;

import com.photo.panogroup.config.YamlConfig;
import com.photo.panogroup.core.feature.DetectorKind;
import com.photo.panogroup.core.graph.RunCancelledException;
import com.photo.panogroup.core.stitcher.StitchOutcome;
import com.photo.panogroup.dto.GroupingRequest;
import com.photo.panogroup.dto.GroupingResponse;
import com.photo.panogroup.service.GroupingReport;
import com.photo.panogroup.service.OverlapGroupingService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 重叠分组控制器
 * <p>
 * 请求中未填写的参数使用 application.yml 中 pano-group 下的默认值
 */
@RestController
@RequestMapping("/api/groups")
@Tag(name = "重叠分组", description = "扫描目录、检测照片间重叠、按连通分量分组，并可逐组调用外部拼接工具")
public class GroupingController {
    private static final Logger logger = LoggerFactory.getLogger(GroupingController.class);

    @Autowired
    private OverlapGroupingService groupingService;

    @Autowired
    private YamlConfig yamlConfig;

    /**
     * 查找可拼接的分组
     */
    @PostMapping
    @Operation(
            summary = "查找可拼接的分组",
            description = """
                    递归扫描目录，提取特征并两两匹配（相邻模式下只比较拍摄顺序相邻的照片），
                    返回包含 2 张及以上照片的分组。超过最大分组大小的分组放在 skippedGroups 中。

                    **请求字段说明**：
                    | 字段 | 类型 | 说明 |
                    |------|------|------|
                    | directory | string | 照片根目录（必填）|
                    | detector | string | SIFT / ORB |
                    | minMatches | number | 判定重叠的最少内点数，>= 1 |
                    | maxGroupSize | number | 最大分组大小，<= 0 不限制 |
                    | consecutive | boolean | 只比较相邻照片 |
                    """
    )
    @ApiResponses(value = {
            @ApiResponse(
                    responseCode = "200",
                    description = "分组成功",
                    content = @Content(
                            mediaType = "application/json",
                            examples = @ExampleObject(
                                    value = """
                                            {
                                              "status": "success",
                                              "data": {
                                                "directory": "/photos/trip",
                                                "detector": "SIFT",
                                                "imageCount": 5,
                                                "groups": [["/photos/trip/1.jpg", "/photos/trip/2.jpg", "/photos/trip/3.jpg"]],
                                                "skippedGroups": []
                                              }
                                            }
                                            """
                            )
                    )
            )
    })
    public ResponseEntity<Map<String, Object>> findGroups(@RequestBody GroupingRequest request) {
        Map<String, Object> response = new HashMap<>();
        try {
            GroupingReport report = run(request);
            response.put("status", "success");
            response.put("data", GroupingResponse.from(report));
            return ResponseEntity.ok(response);
        } catch (Exception e) {
            return handleError(response, e);
        }
    }

    /**
     * 分组并逐组拼接
     */
    @PostMapping("/stitch")
    @Operation(
            summary = "分组并拼接",
            description = """
                    先按 /api/groups 的规则分组，再按拍摄顺序把每组交给配置的拼接工具链。
                    输出文件名为 <输出前缀><首张照片名>_<张数>.jpg，写在与首张照片相同的子目录下，之后扫描时会被自动忽略。
                    单组拼接失败只体现在 stitched 列表中，不影响其它组。
                    """
    )
    public ResponseEntity<Map<String, Object>> stitchGroups(@RequestBody GroupingRequest request) {
        Map<String, Object> response = new HashMap<>();
        try {
            GroupingReport report = run(request);
            List<StitchOutcome> outcomes = groupingService.stitchGroups(report);
            response.put("status", "success");
            response.put("data", GroupingResponse.from(report).withStitched(outcomes));
            return ResponseEntity.ok(response);
        } catch (Exception e) {
            return handleError(response, e);
        }
    }

    private GroupingReport run(GroupingRequest request) throws Exception {
        if (request == null || request.getDirectory() == null || request.getDirectory().isBlank()) {
            throw new IllegalArgumentException("directory is required");
        }
        DetectorKind detector = DetectorKind.parse(request.getDetector());
        if (detector == null) {
            detector = yamlConfig.getFeatures().getDefaultDetector();
        }
        int minMatches = request.getMinMatches() != null
                ? request.getMinMatches() : yamlConfig.getMatching().getMinMatches();
        int maxGroupSize = request.getMaxGroupSize() != null
                ? request.getMaxGroupSize() : yamlConfig.getGrouping().getMaxGroupSize();
        boolean consecutive = request.getConsecutive() != null
                ? request.getConsecutive() : yamlConfig.getGrouping().isConsecutive();

        return groupingService.findGroups(Path.of(request.getDirectory()), detector, minMatches,
                maxGroupSize, consecutive);
    }

    private ResponseEntity<Map<String, Object>> handleError(Map<String, Object> response, Exception e) {
        if (e instanceof IllegalArgumentException) {
            response.put("status", "error");
            response.put("message", e.getMessage());
            return ResponseEntity.badRequest().body(response);
        }
        if (e instanceof RunCancelledException) {
            logger.info("Grouping run cancelled: {}", e.getMessage());
            response.put("status", "cancelled");
            response.put("message", e.getMessage());
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(response);
        }
        logger.error("Grouping failed", e);
        response.put("status", "error");
        response.put("message", e.getMessage());
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(response);
    }
}
